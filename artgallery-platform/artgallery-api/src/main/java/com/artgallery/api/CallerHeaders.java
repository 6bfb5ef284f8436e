package com.artgallery.api;

/**
 * Request headers carrying the authenticated caller.
 */
public final class CallerHeaders {

    /** Identity of the caller, trusted as authenticated upstream. */
    public static final String CALLER_ID = "X-Caller-ID";

    private CallerHeaders() {
    }
}
