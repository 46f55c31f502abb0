package io.hivescan.client;

import static io.hivescan.common.HivescanHeaders.APPLICATION_JSON;
import static io.hivescan.common.HivescanHeaders.CONTENT_TYPE;
import static io.hivescan.common.HivescanHeaders.X_HONEYCOMB_TEAM;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hivescan.client.config.FanOutSettings;
import io.hivescan.client.fanout.BoundedFanOut;
import io.hivescan.client.fanout.FetchOutcome;
import io.hivescan.client.fanout.LoggingProgressSink;
import io.hivescan.client.fanout.OrderedFanOut;
import io.hivescan.client.fanout.ProgressSink;
import io.hivescan.client.http.HttpClient;
import io.hivescan.spec.Authorizations;
import io.hivescan.spec.Column;
import io.hivescan.spec.Dataset;
import io.hivescan.spec.HivescanClientException;
import io.hivescan.spec.Query;
import io.hivescan.spec.QueryResult;
import io.hivescan.util.Assert;
import io.hivescan.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Asynchronous client for the parts of the Honeycomb API used to survey datasets, columns and
 * query results.
 * <p>
 * Every request carries the API key and goes through a {@link RetryingRequestExecutor}, so rate
 * limiting is absorbed up to the configured retry budget. The transport is shared by all
 * concurrent requests of the client.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HoneycombClient client = HoneycombClient.builder(HoneycombCredentials.fromEnvironment()).build();
 *
 * List<String> datasets = client.getDatasetSlugs(7, null).join();
 * client.processDatasetsColumns(7, datasets,
 *         (dataset, columns) -> System.out.println(dataset + ": " + columns.size() + " columns"))
 *     .join();
 * }</pre>
 */
public class HoneycombClient {

    private static final TypeReference<Authorizations> AUTHORIZATIONS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Dataset>> DATASETS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Column>> COLUMNS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Query> QUERY_TYPE = new TypeReference<>() {};
    private static final TypeReference<QueryResult> QUERY_RESULT_TYPE = new TypeReference<>() {};
    private static final TypeReference<JsonNode> JSON_NODE_TYPE = new TypeReference<>() {};

    private final Map<String, String> headers;
    private final FanOutSettings settings;
    private final HttpClient httpClient;
    private final RetryingRequestExecutor executor;
    private final QueryResultPoller poller;
    private final @Nullable ProgressSink progressSink;
    private final Clock clock;

    private HoneycombClient(Builder builder) {
        this.headers = Map.of(
                X_HONEYCOMB_TEAM, builder.credentials.apiKey(),
                CONTENT_TYPE, APPLICATION_JSON);
        this.settings = builder.settings;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.createHttpClient(settings.getApiUrl());
        this.executor = new RetryingRequestExecutor(settings, builder.sleeper);
        this.poller = new QueryResultPoller(settings, builder.sleeper);
        this.progressSink = builder.progressSink;
        this.clock = builder.clock;
    }

    public static Builder builder(HoneycombCredentials credentials) {
        return new Builder(credentials);
    }

    public FanOutSettings getSettings() {
        return settings;
    }

    public CompletableFuture<Authorizations> listAuthorizations() {
        return get("auth", AUTHORIZATIONS_TYPE);
    }

    public CompletableFuture<List<Dataset>> listAllDatasets() {
        return get("datasets", DATASETS_TYPE);
    }

    public CompletableFuture<List<Column>> listAllColumns(String datasetSlug) {
        Assert.checkNotNullParam("datasetSlug", datasetSlug);
        return get("columns/" + datasetSlug, COLUMNS_TYPE);
    }

    /**
     * Lists the slugs of datasets written to within the last {@code lastWrittenDays} days.
     * A dataset without a last-written timestamp counts as written now.
     *
     * @param lastWrittenDays the age limit in whole days
     * @param includeDatasets restricts the result to these slugs; {@code null} or empty means no restriction
     * @return the matching slugs, sorted
     */
    public CompletableFuture<List<String>> getDatasetSlugs(int lastWrittenDays, @Nullable Set<String> includeDatasets) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Set<String> include = includeDatasets == null ? Set.of() : includeDatasets;
        return listAllDatasets().thenApply(datasets -> {
            List<String> slugs = new ArrayList<>();
            for (Dataset dataset : datasets) {
                OffsetDateTime lastWritten = dataset.lastWrittenAt() == null ? now : dataset.lastWrittenAt();
                if (writtenWithin(lastWritten, now, lastWrittenDays)
                        && (include.isEmpty() || include.contains(dataset.slug()))) {
                    slugs.add(dataset.slug());
                }
            }
            slugs.sort(null);
            return slugs;
        });
    }

    /**
     * Fetches the columns of every dataset concurrently and hands them to the consumer in the
     * order of {@code datasets}. Only columns written within {@code lastWrittenDays} days are
     * passed on. A dataset whose columns cannot be fetched is logged and passed on with an empty
     * list.
     *
     * @param lastWrittenDays the age limit in whole days
     * @param datasets the dataset slugs, in delivery order
     * @param consumer receives each dataset with its recent columns
     * @return a future completing once every dataset has been delivered
     */
    public CompletableFuture<Void> processDatasetsColumns(int lastWrittenDays, List<String> datasets,
                                                          BiConsumer<String, List<Column>> consumer) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OrderedFanOut<String, List<Column>> fanOut = new OrderedFanOut<>(List::of);
        return fanOut.aggregate(datasets,
                dataset -> listAllColumns(dataset).thenApply(columns -> recentColumns(columns, now, lastWrittenDays)),
                consumer);
    }

    public CompletableFuture<Query> createQuery(String datasetSlug, JsonNode query) {
        Assert.checkNotNullParam("datasetSlug", datasetSlug);
        return post("queries/" + datasetSlug, query, QUERY_TYPE);
    }

    /**
     * Starts the asynchronous computation of a saved query.
     *
     * @param datasetSlug the dataset the query was saved for
     * @param queryId the id returned by {@link #createQuery(String, JsonNode)}
     * @return the initial status of the result, carrying the id to poll with
     */
    public CompletableFuture<QueryResult> createQueryResult(String datasetSlug, String queryId) {
        Assert.checkNotNullParam("datasetSlug", datasetSlug);
        Assert.checkNotNullParam("queryId", queryId);
        ObjectNode body = Utils.OBJECT_MAPPER.createObjectNode()
                .put("query_id", queryId)
                .put("disable_series", false)
                .put("limit", settings.getQueryResultLimit());
        return post("query_results/" + datasetSlug, body, QUERY_RESULT_TYPE);
    }

    /**
     * Saves the query, starts its result and returns the link to the result in the Honeycomb UI.
     */
    public CompletableFuture<String> getQueryUrl(String datasetSlug, JsonNode query) {
        return createQuery(datasetSlug, query)
                .thenCompose(created -> createQueryResult(datasetSlug, created.id()))
                .thenCompose(result -> {
                    if (result.links() == null || result.links().queryUrl() == null) {
                        return CompletableFuture.failedFuture(
                                new HivescanClientException("Query result for dataset " + datasetSlug + " has no query_url"));
                    }
                    return CompletableFuture.completedFuture(result.links().queryUrl());
                });
    }

    public CompletableFuture<String> getExistsQueryUrl(String datasetSlug, String columnId) {
        return getQueryUrl(datasetSlug, HoneycombQueries.exists(columnId, settings.getQueryTimeRange()));
    }

    public CompletableFuture<String> getAvgQueryUrl(String datasetSlug, String columnId) {
        return getQueryUrl(datasetSlug, HoneycombQueries.average(columnId, settings.getQueryTimeRange()));
    }

    /**
     * Polls a started query result until it is complete or the poll budget is spent.
     *
     * @return the payload; check {@link QueryPayload#isComplete()} before reading an empty result as "no data"
     */
    public CompletableFuture<QueryPayload> pollQueryResult(String datasetSlug, String queryResultId) {
        Assert.checkNotNullParam("datasetSlug", datasetSlug);
        Assert.checkNotNullParam("queryResultId", queryResultId);
        String path = "query_results/" + datasetSlug + "/" + queryResultId;
        return poller.poll(() -> get(path, JSON_NODE_TYPE));
    }

    /**
     * Saves the query, starts its result and polls it.
     */
    public CompletableFuture<QueryPayload> runQuery(String datasetSlug, JsonNode query) {
        return createQuery(datasetSlug, query)
                .thenCompose(created -> createQueryResult(datasetSlug, created.id()))
                .thenCompose(result -> {
                    if (result.id() == null) {
                        return CompletableFuture.failedFuture(
                                new HivescanClientException("Query result for dataset " + datasetSlug + " has no id"));
                    }
                    return pollQueryResult(datasetSlug, result.id());
                });
    }

    /**
     * Runs one query per column, at most {@link FanOutSettings#getConcurrencyLimit()} at a time,
     * reporting progress after each. A column whose query fails gets {@link QueryPayload#empty()}
     * and the failure on its outcome.
     *
     * @param datasetSlug the dataset the columns belong to
     * @param columns the columns to query
     * @param queryFactory builds the query for one column, see {@link HoneycombQueries}
     * @return one outcome per column, in completion order
     */
    public CompletableFuture<List<FetchOutcome<Column, QueryPayload>>> queryColumns(
            String datasetSlug, Collection<Column> columns, Function<Column, JsonNode> queryFactory) {
        Assert.checkNotNullParam("datasetSlug", datasetSlug);
        Assert.checkNotNullParam("queryFactory", queryFactory);
        ProgressSink sink = progressSink != null ? progressSink : new LoggingProgressSink(datasetSlug + " columns");
        BoundedFanOut<Column, QueryPayload> fanOut =
                new BoundedFanOut<>(settings.getConcurrencyLimit(), QueryPayload::empty, sink);
        return fanOut.aggregate(columns, column -> runQuery(datasetSlug, queryFactory.apply(column)));
    }

    private static List<Column> recentColumns(List<Column> columns, OffsetDateTime now, int lastWrittenDays) {
        List<Column> recent = new ArrayList<>();
        for (Column column : columns) {
            if (column.lastWritten() != null && writtenWithin(column.lastWritten(), now, lastWrittenDays)) {
                recent.add(column);
            }
        }
        return recent;
    }

    private static boolean writtenWithin(OffsetDateTime lastWritten, OffsetDateTime now, int days) {
        return Duration.between(lastWritten, now).toDays() < days;
    }

    private <T> CompletableFuture<T> get(String path, TypeReference<T> type) {
        return executor.execute(() -> withHeaders(httpClient.get(path)).send(), type);
    }

    private <T> CompletableFuture<T> post(String path, JsonNode body, TypeReference<T> type) {
        String json;
        try {
            json = Utils.marshal(body);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new HivescanClientException("Could not serialize request body", e));
        }
        return executor.execute(() -> withHeaders(httpClient.post(path)).send(json), type);
    }

    private <B extends HttpClient.RequestBuilder<B>> B withHeaders(B builder) {
        return builder.addHeaders(headers);
    }

    public static class Builder {
        private final HoneycombCredentials credentials;
        private FanOutSettings settings = FanOutSettings.defaults();
        private @Nullable HttpClient httpClient;
        private Sleeper sleeper = Sleeper.DEFAULT;
        private @Nullable ProgressSink progressSink;
        private Clock clock = Clock.systemUTC();

        private Builder(HoneycombCredentials credentials) {
            this.credentials = Assert.checkNotNullParam("credentials", credentials);
        }

        public Builder settings(FanOutSettings settings) {
            this.settings = Assert.checkNotNullParam("settings", settings);
            return this;
        }

        /**
         * @param httpClient the transport to use; defaults to a JDK client for {@link FanOutSettings#getApiUrl()}
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = Assert.checkNotNullParam("httpClient", httpClient);
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Assert.checkNotNullParam("sleeper", sleeper);
            return this;
        }

        /**
         * @param progressSink receives progress of {@link #queryColumns}; defaults to an INFO log line per column
         */
        public Builder progressSink(ProgressSink progressSink) {
            this.progressSink = Assert.checkNotNullParam("progressSink", progressSink);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Assert.checkNotNullParam("clock", clock);
            return this;
        }

        public HoneycombClient build() {
            return new HoneycombClient(this);
        }
    }
}
