package com.factory.stockkeeper.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CompletionResult(String receiptNo, String batchNo, BigDecimal quantity, LocalDate expiryDate) {
}
