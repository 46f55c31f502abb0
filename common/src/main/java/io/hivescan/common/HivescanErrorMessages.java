package io.hivescan.common;

public final class HivescanErrorMessages {

    public static final String AUTHENTICATION_FAILED = "Authentication failed: API key rejected";
    public static final String AUTHORIZATION_FAILED = "Authorization failed: API key lacks access to this resource";
    public static final String RATE_LIMIT_EXHAUSTED = "Too many retries: still rate limited after %d attempts";
    public static final String INVALID_JSON = "Failed to parse JSON data (status %d)";
    public static final String MISSING_CREDENTIAL = "Environment variable %s not found";

    private HivescanErrorMessages() {
    }
}
