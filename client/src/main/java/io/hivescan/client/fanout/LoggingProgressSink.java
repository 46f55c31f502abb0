package io.hivescan.client.fanout;

import io.hivescan.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one INFO line per completed item, for example {@code api columns: 3/17}.
 */
public class LoggingProgressSink implements ProgressSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressSink.class);

    private final String label;

    public LoggingProgressSink(String label) {
        this.label = Assert.checkNotNullParam("label", label);
    }

    @Override
    public void report(int completed, int total) {
        LOGGER.info("{}: {}/{}", label, completed, total);
    }
}
