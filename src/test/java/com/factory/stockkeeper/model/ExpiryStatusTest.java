package com.factory.stockkeeper.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExpiryStatusTest {

    private final LocalDate today = LocalDate.of(2026, 5, 10);

    @Test
    void classify_usesDayThresholds() {
        assertEquals(ExpiryStatus.EXPIRED, classify(today.minusDays(1)));
        assertEquals(ExpiryStatus.CRITICAL, classify(today));
        assertEquals(ExpiryStatus.CRITICAL, classify(today.plusDays(7)));
        assertEquals(ExpiryStatus.WARNING, classify(today.plusDays(8)));
        assertEquals(ExpiryStatus.WARNING, classify(today.plusDays(30)));
        assertEquals(ExpiryStatus.OK, classify(today.plusDays(31)));
    }

    @Test
    void classify_noExpiryIsOk() {
        assertEquals(ExpiryStatus.OK, classify(null));
    }

    private ExpiryStatus classify(LocalDate expiry) {
        return ExpiryStatus.classify(expiry, today, 7, 30);
    }
}
