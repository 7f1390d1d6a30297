package com.example.relay.shared.exception;

/**
 * Refresh token is malformed, revoked, expired, not a refresh token, or bound to an unpaired device.
 */
public class RefreshInvalidException extends AuthFailureException {
    public RefreshInvalidException(String message) {
        super(message);
    }
}
