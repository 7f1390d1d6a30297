package com.example.relay.shared.exception;

public class PairingCodeAlreadyIssuedException extends RuntimeException {
    public PairingCodeAlreadyIssuedException(String message) {
        super(message);
    }
}
