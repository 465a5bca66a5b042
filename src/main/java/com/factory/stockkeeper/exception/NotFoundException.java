package com.factory.stockkeeper.exception;

public class NotFoundException extends ManufacturingException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String what, Object id) {
        return new NotFoundException(what + " not found: " + id);
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
