package com.factory.stockkeeper.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DailyQuantityRow(LocalDate date, String category, BigDecimal quantity) {
}
