package io.hivescan.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.hivescan.client.config.FanOutSettings;
import io.hivescan.spec.QueryResultLinks;
import io.hivescan.spec.QueryResultRow;
import io.hivescan.util.Assert;
import io.hivescan.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls an asynchronous query result until the server reports it complete or the poll budget
 * is used up.
 * <p>
 * The status is read leniently: a {@code data} or {@code links} block that is missing or has an
 * unexpected shape contributes nothing rather than failing the poll, because a partial result
 * is still worth returning. Running out of polls is not an error either; the payload is then
 * marked {@link PollOutcome#TIMED_OUT} and carries whatever the last status contained.
 * Failing to fetch a status (transport, decoding, rate-limit exhaustion) does fail the poll.
 */
public class QueryResultPoller {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryResultPoller.class);

    private static final TypeReference<Map<String, Object>> ROW_DATA_TYPE = new TypeReference<>() {};

    private final int pollBudget;
    private final Duration pollInterval;
    private final Sleeper sleeper;

    public QueryResultPoller(FanOutSettings settings, Sleeper sleeper) {
        this(settings.getPollBudget(), settings.getPollInterval(), sleeper);
    }

    public QueryResultPoller(int pollBudget, Duration pollInterval, Sleeper sleeper) {
        this.pollBudget = Assert.checkMinimumParam("pollBudget", 1, pollBudget);
        this.pollInterval = Assert.checkNotNullParam("pollInterval", pollInterval);
        this.sleeper = Assert.checkNotNullParam("sleeper", sleeper);
    }

    /**
     * @param fetchStatus fetches the current status of the job; invoked once per poll
     * @return the payload, never failing because the job did not finish in time
     */
    public CompletableFuture<QueryPayload> poll(Supplier<CompletableFuture<JsonNode>> fetchStatus) {
        Assert.checkNotNullParam("fetchStatus", fetchStatus);
        return poll(fetchStatus, 1);
    }

    private CompletableFuture<QueryPayload> poll(Supplier<CompletableFuture<JsonNode>> fetchStatus, int polls) {
        CompletableFuture<JsonNode> fetched;
        try {
            fetched = fetchStatus.get();
        } catch (RuntimeException e) {
            fetched = CompletableFuture.failedFuture(e);
        }
        return fetched.thenCompose(status -> {
            if (status.path("complete").asBoolean(false)) {
                LOGGER.debug("Query result complete after {} polls", polls);
                return CompletableFuture.completedFuture(extract(status, PollOutcome.COMPLETE, polls));
            }
            if (polls >= pollBudget) {
                LOGGER.warn("Query result still incomplete after {} polls, returning partial payload", polls);
                return CompletableFuture.completedFuture(extract(status, PollOutcome.TIMED_OUT, polls));
            }
            return sleeper.sleep(pollInterval).thenCompose(v -> poll(fetchStatus, polls + 1));
        });
    }

    static QueryPayload extract(JsonNode status, PollOutcome outcome, int polls) {
        return new QueryPayload(outcome, extractRows(status), extractLinks(status), polls);
    }

    private static List<QueryResultRow> extractRows(JsonNode status) {
        JsonNode results = status.path("data").path("results");
        if (!results.isArray()) {
            return List.of();
        }
        List<QueryResultRow> rows = new ArrayList<>(results.size());
        for (JsonNode result : results) {
            JsonNode data = result.path("data");
            if (data.isObject()) {
                rows.add(new QueryResultRow(Utils.OBJECT_MAPPER.convertValue(data, ROW_DATA_TYPE)));
            } else {
                LOGGER.debug("Query result row without data object: {}", result);
                rows.add(new QueryResultRow(Map.of()));
            }
        }
        return rows;
    }

    private static @Nullable QueryResultLinks extractLinks(JsonNode status) {
        JsonNode links = status.path("links");
        if (!links.isObject()) {
            return null;
        }
        return new QueryResultLinks(textOrNull(links.path("query_url")), textOrNull(links.path("graph_image_url")));
    }

    private static @Nullable String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}
