package com.incidents.adapter.exception;

public class UnauthorizedException extends RuntimeException {

    private final boolean misconfigured;

    public UnauthorizedException(String message, boolean misconfigured) {
        super(message);
        this.misconfigured = misconfigured;
    }

    /**
     * True when the server has no secret configured at all
     */
    public boolean isMisconfigured() {
        return misconfigured;
    }
}
