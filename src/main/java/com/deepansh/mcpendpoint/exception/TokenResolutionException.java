package com.deepansh.mcpendpoint.exception;

public class TokenResolutionException extends BrokerException {

    public TokenResolutionException(String message) {
        super(message);
    }

    public TokenResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
