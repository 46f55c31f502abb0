package io.hivescan.client;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Completes every sleep immediately and remembers the requested durations.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<Void> sleep(Duration duration) {
        sleeps.add(duration);
        return CompletableFuture.completedFuture(null);
    }

    public List<Duration> getSleeps() {
        return sleeps;
    }
}
