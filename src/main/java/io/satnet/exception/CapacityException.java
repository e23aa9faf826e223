package io.satnet.exception;

public class CapacityException extends DtnException {

    public CapacityException(String message) {
        super(DtnErrorType.CAPACITY, message);
    }
}
