package com.example.relay.shared.exception;

public class TokenExpiredException extends AuthFailureException {
    public TokenExpiredException(String message) {
        super(message);
    }
}
