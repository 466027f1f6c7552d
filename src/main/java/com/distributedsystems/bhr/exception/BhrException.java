package com.distributedsystems.bhr.exception;

import lombok.Getter;

/**
 * Base of every failure the registry reports to its caller. Each subtype carries a
 * stable machine-readable code that the HTTP and gRPC layers pass through unchanged.
 */
@Getter
public abstract class BhrException extends RuntimeException {

    private final String code;

    protected BhrException(String code, String message) {
        super(message);
        this.code = code;
    }
}
