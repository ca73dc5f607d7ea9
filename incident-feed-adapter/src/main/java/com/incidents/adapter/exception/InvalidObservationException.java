package com.incidents.adapter.exception;

/**
 * The observation cannot be reconciled; nothing was written.
 */
public class InvalidObservationException extends RuntimeException {

    public InvalidObservationException(String message) {
        super(message);
    }
}
