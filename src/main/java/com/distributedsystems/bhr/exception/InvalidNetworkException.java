package com.distributedsystems.bhr.exception;

import lombok.Getter;

@Getter
public class InvalidNetworkException extends BhrException {

    private final String input;

    public InvalidNetworkException(String input, String detail) {
        super("invalid_network", "Invalid network '" + input + "': " + detail);
        this.input = input;
    }
}
