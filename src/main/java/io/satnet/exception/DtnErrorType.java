package io.satnet.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DtnErrorType {
    VALIDATION("validation"),
    NOT_FOUND("not_found"),
    CAPACITY("capacity"),
    NO_ROUTE("no_route"),
    ;

    private final String code;
}
