package com.factory.stockkeeper.model;

import java.time.LocalDate;

public enum ExpiryStatus {
    EXPIRED,
    CRITICAL,
    WARNING,
    OK;

    /**
     * Classifies an expiry date relative to {@code today}. Lots without an expiry never age.
     */
    public static ExpiryStatus classify(LocalDate expiryDate, LocalDate today, int criticalDays, int warningDays) {
        if (expiryDate == null) {
            return OK;
        }
        if (expiryDate.isBefore(today)) {
            return EXPIRED;
        }
        if (!expiryDate.isAfter(today.plusDays(criticalDays))) {
            return CRITICAL;
        }
        if (!expiryDate.isAfter(today.plusDays(warningDays))) {
            return WARNING;
        }
        return OK;
    }
}
