package com.factory.stockkeeper.service;

import com.factory.stockkeeper.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Column limits shared by the request DTOs and the command services. Quantities are stored
 * as {@code NUMERIC(18,4)}.
 */
public final class InputLimits {

    public static final int QTY_INTEGER_DIGITS = 14;
    public static final int QTY_FRACTION_DIGITS = 4;
    public static final int CODE_LENGTH = 100;
    public static final int NAME_LENGTH = 255;
    public static final int NOTES_LENGTH = 1000;

    private InputLimits() {
    }

    public static void checkQuantity(String field, BigDecimal value) {
        if (value == null) {
            return;
        }
        BigDecimal normalized = value.stripTrailingZeros();
        int fraction = Math.max(normalized.scale(), 0);
        int integer = normalized.precision() - normalized.scale();
        if (fraction > QTY_FRACTION_DIGITS || integer > QTY_INTEGER_DIGITS) {
            throw new ValidationException(field + " " + value.toPlainString() + " exceeds " + QTY_INTEGER_DIGITS
                    + " integer and " + QTY_FRACTION_DIGITS + " decimal digits");
        }
    }

    public static void checkLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field + " must be at most " + max + " characters, got " + value.length());
        }
    }
}
