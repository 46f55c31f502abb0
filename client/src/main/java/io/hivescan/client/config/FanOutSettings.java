package io.hivescan.client.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import io.hivescan.spec.HivescanConfigurationException;
import io.hivescan.util.Assert;

/**
 * Policy constants of the orchestrator.
 * <p>
 * The defaults match what the Honeycomb API tolerates in practice. Tests use much smaller
 * budgets and zero intervals to stay fast and deterministic.
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>Property</th><th>Default</th><th>Meaning</th></tr>
 *   <tr><td>{@code hivescan.retry.budget}</td><td>12</td><td>requests sent before giving up on a rate-limited call</td></tr>
 *   <tr><td>{@code hivescan.retry.backoff}</td><td>PT5S</td><td>wait after each rate-limited response</td></tr>
 *   <tr><td>{@code hivescan.poll.budget}</td><td>50</td><td>status checks of a query result before giving up</td></tr>
 *   <tr><td>{@code hivescan.poll.interval}</td><td>PT0.1S</td><td>wait between status checks</td></tr>
 *   <tr><td>{@code hivescan.fanout.concurrency}</td><td>3</td><td>fetches in flight in a bounded fan-out</td></tr>
 *   <tr><td>{@code hivescan.api.url}</td><td>https://api.honeycomb.io/1/</td><td>API base URL</td></tr>
 *   <tr><td>{@code hivescan.query.result-limit}</td><td>10000</td><td>row limit of a query result</td></tr>
 *   <tr><td>{@code hivescan.query.time-range}</td><td>604800</td><td>time range in seconds of the canned queries</td></tr>
 * </table>
 */
public final class FanOutSettings {

    public static final String RETRY_BUDGET = "hivescan.retry.budget";
    public static final String RETRY_BACKOFF = "hivescan.retry.backoff";
    public static final String POLL_BUDGET = "hivescan.poll.budget";
    public static final String POLL_INTERVAL = "hivescan.poll.interval";
    public static final String FANOUT_CONCURRENCY = "hivescan.fanout.concurrency";
    public static final String API_URL = "hivescan.api.url";
    public static final String QUERY_RESULT_LIMIT = "hivescan.query.result-limit";
    public static final String QUERY_TIME_RANGE = "hivescan.query.time-range";

    private static final FanOutSettings DEFAULTS = builder().build();

    private final int retryBudget;
    private final Duration rateLimitBackoff;
    private final int pollBudget;
    private final Duration pollInterval;
    private final int concurrencyLimit;
    private final String apiUrl;
    private final int queryResultLimit;
    private final long queryTimeRange;

    private FanOutSettings(Builder builder) {
        this.retryBudget = Assert.checkMinimumParam("retryBudget", 1, builder.retryBudget);
        this.rateLimitBackoff = checkNotNegative("rateLimitBackoff", builder.rateLimitBackoff);
        this.pollBudget = Assert.checkMinimumParam("pollBudget", 1, builder.pollBudget);
        this.pollInterval = checkNotNegative("pollInterval", builder.pollInterval);
        this.concurrencyLimit = Assert.checkMinimumParam("concurrencyLimit", 1, builder.concurrencyLimit);
        this.apiUrl = Assert.checkNotBlankParam("apiUrl", builder.apiUrl);
        this.queryResultLimit = Assert.checkMinimumParam("queryResultLimit", 1, builder.queryResultLimit);
        this.queryTimeRange = builder.queryTimeRange;
        if (queryTimeRange < 1) {
            throw new IllegalArgumentException("Parameter 'queryTimeRange' must be at least 1 but was " + queryTimeRange);
        }
    }

    public static FanOutSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads every setting from the provider, falling back to the built-in default for names it
     * does not know.
     *
     * @param provider the configuration source
     * @return the settings
     * @throws HivescanConfigurationException if a configured value cannot be parsed or is out of range
     */
    public static FanOutSettings from(HivescanConfigProvider provider) throws HivescanConfigurationException {
        Assert.checkNotNullParam("provider", provider);
        Builder builder = builder();
        try {
            readInt(provider, RETRY_BUDGET).ifPresent(builder::retryBudget);
            readDuration(provider, RETRY_BACKOFF).ifPresent(builder::rateLimitBackoff);
            readInt(provider, POLL_BUDGET).ifPresent(builder::pollBudget);
            readDuration(provider, POLL_INTERVAL).ifPresent(builder::pollInterval);
            readInt(provider, FANOUT_CONCURRENCY).ifPresent(builder::concurrencyLimit);
            provider.getOptionalValue(API_URL).ifPresent(builder::apiUrl);
            readInt(provider, QUERY_RESULT_LIMIT).ifPresent(builder::queryResultLimit);
            readInt(provider, QUERY_TIME_RANGE).ifPresent(builder::queryTimeRange);
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new HivescanConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static Optional<Integer> readInt(HivescanConfigProvider provider, String name) {
        return provider.getOptionalValue(name).map(value -> {
            try {
                return Integer.valueOf(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " is not a number: " + value, e);
            }
        });
    }

    private static Optional<Duration> readDuration(HivescanConfigProvider provider, String name) {
        return provider.getOptionalValue(name).map(value -> {
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(name + " is not an ISO-8601 duration: " + value, e);
            }
        });
    }

    private static Duration checkNotNegative(String name, Duration value) {
        Assert.checkNotNullParam(name, value);
        if (value.isNegative()) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be negative");
        }
        return value;
    }

    public int getRetryBudget() {
        return retryBudget;
    }

    public Duration getRateLimitBackoff() {
        return rateLimitBackoff;
    }

    public int getPollBudget() {
        return pollBudget;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public int getQueryResultLimit() {
        return queryResultLimit;
    }

    public long getQueryTimeRange() {
        return queryTimeRange;
    }

    @Override
    public String toString() {
        return "FanOutSettings{retryBudget=" + retryBudget
                + ", rateLimitBackoff=" + rateLimitBackoff
                + ", pollBudget=" + pollBudget
                + ", pollInterval=" + pollInterval
                + ", concurrencyLimit=" + concurrencyLimit
                + ", apiUrl=" + apiUrl + '}';
    }

    public static class Builder {
        private int retryBudget = 12;
        private Duration rateLimitBackoff = Duration.ofSeconds(5);
        private int pollBudget = 50;
        private Duration pollInterval = Duration.ofMillis(100);
        private int concurrencyLimit = 3;
        private String apiUrl = "https://api.honeycomb.io/1/";
        private int queryResultLimit = 10000;
        private long queryTimeRange = 604800;

        private Builder() {
        }

        public Builder retryBudget(int retryBudget) {
            this.retryBudget = retryBudget;
            return this;
        }

        public Builder rateLimitBackoff(Duration rateLimitBackoff) {
            this.rateLimitBackoff = rateLimitBackoff;
            return this;
        }

        public Builder pollBudget(int pollBudget) {
            this.pollBudget = pollBudget;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder concurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        public Builder apiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
            return this;
        }

        public Builder queryResultLimit(int queryResultLimit) {
            this.queryResultLimit = queryResultLimit;
            return this;
        }

        public Builder queryTimeRange(long queryTimeRange) {
            this.queryTimeRange = queryTimeRange;
            return this;
        }

        /**
         * @return the settings
         * @throws IllegalArgumentException if a budget or limit is below 1 or a duration is negative
         */
        public FanOutSettings build() {
            return new FanOutSettings(this);
        }
    }
}
