package io.hivescan.client;

/**
 * How a poll of an asynchronous query result ended.
 * <p>
 * Separates "the computation finished" from "the poll budget ran out first", which would
 * otherwise both look like an empty result.
 */
public enum PollOutcome {
    /** The server reported the result as complete. Its rows may still be empty. */
    COMPLETE,

    /** The poll budget was exhausted first; the payload is whatever the last status contained. */
    TIMED_OUT
}
