package com.example.relay.shared.exception;

/**
 * Base type for every credential failure: bad secret, bad or expired token,
 * unusable pairing code. WebSocket connections failing with it are closed with 4401.
 */
public class AuthFailureException extends RuntimeException {
    public AuthFailureException(String message) {
        super(message);
    }

    public AuthFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
