package com.example.relay.shared.exception;

public class InvalidOrExpiredCodeException extends AuthFailureException {
    public InvalidOrExpiredCodeException(String message) {
        super(message);
    }
}
