package io.hivescan.spec;

import static io.hivescan.common.HivescanErrorMessages.RATE_LIMIT_EXHAUSTED;

/**
 * The server kept answering with a rate-limit status until the retry budget ran out.
 */
public class HivescanTooManyRetriesException extends HivescanClientException {

    private final int attempts;

    /**
     * @param attempts the number of requests sent, all of which were rate limited
     */
    public HivescanTooManyRetriesException(final int attempts) {
        super(String.format(RATE_LIMIT_EXHAUSTED, attempts));
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
