package com.example.relay.shared.exception;

public class TokenInvalidException extends AuthFailureException {
    public TokenInvalidException(String message) {
        super(message);
    }

    public TokenInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
