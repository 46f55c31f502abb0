package io.hivescan.client.fanout;

/**
 * Receives a notification each time a fetch of a bounded fan-out completes.
 * <p>
 * Calls are serialized by the aggregator. Implementations must return quickly; an exception
 * thrown from {@link #report(int, int)} is logged and otherwise ignored.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NOOP = (completed, total) -> { };

    /**
     * @param completed how many items have completed so far, successfully or not
     * @param total how many items the fan-out was started with
     */
    void report(int completed, int total);
}
