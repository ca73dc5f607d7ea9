package com.incidents.adapter.exception;

/**
 * The incident store could not be reached. Never retried here; the caller fails the request.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
