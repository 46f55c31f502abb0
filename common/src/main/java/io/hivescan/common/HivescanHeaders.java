package io.hivescan.common;

/**
 * HTTP header names used when talking to the Honeycomb API.
 */
public final class HivescanHeaders {

    /** Carries the API key on every request. */
    public static final String X_HONEYCOMB_TEAM = "X-Honeycomb-Team";

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String APPLICATION_JSON = "application/json";

    private HivescanHeaders() {
    }
}
