package com.factory.stockkeeper.exception;

public class InvalidStateTransitionException extends ManufacturingException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }

    public static InvalidStateTransitionException of(String what, Object from, Object to) {
        return new InvalidStateTransitionException("Cannot move " + what + " from " + from + " to " + to);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_STATE";
    }
}
