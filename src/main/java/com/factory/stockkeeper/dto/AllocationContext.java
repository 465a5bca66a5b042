package com.factory.stockkeeper.dto;

/**
 * Who and what a consumption is booked against: the issuance group, the document number
 * stamped on the ledger rows, and the acting user.
 */
public record AllocationContext(String groupId, String sourceRef, String actor) {
}
