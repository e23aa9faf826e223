package io.satnet.exception;

import java.util.UUID;

public class NotFoundException extends DtnException {

    public NotFoundException(String message) {
        super(DtnErrorType.NOT_FOUND, message);
    }

    public static NotFoundException bundle(UUID id) {
        return new NotFoundException("bundle not found: " + id);
    }
}
