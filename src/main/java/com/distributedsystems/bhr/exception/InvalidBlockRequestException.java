package com.distributedsystems.bhr.exception;

public class InvalidBlockRequestException extends BhrException {

    public InvalidBlockRequestException(String message) {
        super("invalid_request", message);
    }
}
