package com.incidents.adapter.exception;

/**
 * Other writers kept winning the conditional write for the same incident.
 */
public class ConcurrentObservationException extends RuntimeException {

    public ConcurrentObservationException(String incidentId, int attempts, Throwable cause) {
        super(String.format("Incident %s changed concurrently %d times in a row", incidentId, attempts), cause);
    }
}
