package io.satnet.exception;

import lombok.Getter;

/**
 * Base type of every recoverable transport failure. The {@link DtnErrorType} lets callers
 * that catch the base type still tell the failure kinds apart.
 */
@Getter
public class DtnException extends Exception {
    private final DtnErrorType type;

    public DtnException(DtnErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public DtnException(DtnErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }
}
