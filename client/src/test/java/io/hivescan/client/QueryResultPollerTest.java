package io.hivescan.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;
import io.hivescan.spec.HivescanTooManyRetriesException;
import io.hivescan.util.Utils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class QueryResultPollerTest {

    private static final Duration INTERVAL = Duration.ofMillis(100);

    private static final String INCOMPLETE = "{\"id\":\"r1\",\"complete\":false}";
    private static final String COMPLETE = """
            {
              "id": "r1",
              "complete": true,
              "data": {
                "results": [
                  {"data": {"service.name": "api", "COUNT": 12}},
                  {"data": {"service.name": "web", "COUNT": 3}}
                ]
              },
              "links": {
                "query_url": "https://ui.honeycomb.io/q/r1",
                "graph_image_url": "https://ui.honeycomb.io/g/r1.png"
              }
            }""";

    private RecordingSleeper sleeper;
    private QueryResultPoller poller;
    private AtomicInteger polls;

    @BeforeEach
    public void setUp() {
        sleeper = new RecordingSleeper();
        poller = new QueryResultPoller(50, INTERVAL, sleeper);
        polls = new AtomicInteger();
    }

    private static JsonNode json(String json) {
        try {
            return Utils.OBJECT_MAPPER.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Reports the job incomplete until poll {@code completeOn}.
     */
    private Supplier<CompletableFuture<JsonNode>> completingOn(int completeOn) {
        return () -> {
            int poll = polls.incrementAndGet();
            return CompletableFuture.completedFuture(json(poll >= completeOn ? COMPLETE : INCOMPLETE));
        };
    }

    @Test
    public void testCompleteOnFirstPoll() throws Exception {
        QueryPayload payload = poller.poll(completingOn(1)).get();

        assertTrue(payload.isComplete());
        assertEquals(1, payload.polls());
        assertEquals(2, payload.rows().size());
        assertEquals("api", payload.rows().get(0).data().get("service.name"));
        assertEquals(12, payload.rows().get(0).data().get("COUNT"));
        assertNotNull(payload.links());
        assertEquals("https://ui.honeycomb.io/q/r1", payload.links().queryUrl());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    public void testCompleteAfterSeveralPolls() throws Exception {
        QueryPayload payload = poller.poll(completingOn(4)).get();

        assertTrue(payload.isComplete());
        assertEquals(4, payload.polls());
        assertEquals(4, polls.get());
        assertEquals(List.of(INTERVAL, INTERVAL, INTERVAL), sleeper.getSleeps());
    }

    @Test
    public void testNeverCompleteStopsAtBudget() throws Exception {
        QueryPayload payload = poller.poll(completingOn(Integer.MAX_VALUE)).get();

        assertEquals(PollOutcome.TIMED_OUT, payload.outcome());
        assertTrue(payload.isEmpty());
        assertEquals(50, payload.polls());
        assertEquals(50, polls.get());
        assertEquals(49, sleeper.getSleeps().size());
    }

    @Test
    public void testTimedOutKeepsPartialRows() throws Exception {
        QueryResultPoller small = new QueryResultPoller(2, INTERVAL, sleeper);
        String partial = "{\"complete\":false,\"data\":{\"results\":[{\"data\":{\"COUNT\":1}}]}}";

        QueryPayload payload = small.poll(() -> {
            polls.incrementAndGet();
            return CompletableFuture.completedFuture(json(partial));
        }).get();

        assertEquals(PollOutcome.TIMED_OUT, payload.outcome());
        assertEquals(1, payload.rows().size());
        assertEquals(2, polls.get());
    }

    @Test
    public void testCompleteWithoutDataIsEmptyButComplete() throws Exception {
        QueryPayload payload = poller.poll(() -> CompletableFuture.completedFuture(json("{\"complete\":true}"))).get();

        assertTrue(payload.isComplete());
        assertTrue(payload.isEmpty());
        assertNull(payload.links());
    }

    @Test
    public void testLenientExtraction() {
        JsonNode status = json("""
                {
                  "complete": true,
                  "data": {"results": [{"data": "oops"}, {"nodata": 1}, {"data": {"a": "b"}}]},
                  "links": "not an object"
                }""");

        QueryPayload payload = QueryResultPoller.extract(status, PollOutcome.COMPLETE, 1);

        assertEquals(3, payload.rows().size());
        assertEquals(Map.of(), payload.rows().get(0).data());
        assertEquals(Map.of(), payload.rows().get(1).data());
        assertEquals(Map.of("a", "b"), payload.rows().get(2).data());
        assertNull(payload.links());
    }

    @Test
    public void testResultsNotAnArray() {
        QueryPayload payload = QueryResultPoller.extract(
                json("{\"complete\":true,\"data\":{\"results\":{}}}"), PollOutcome.COMPLETE, 1);

        assertTrue(payload.isEmpty());
    }

    @Test
    public void testFetchFailureFailsThePoll() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> poller.poll(() -> {
            int poll = polls.incrementAndGet();
            if (poll == 3) {
                return CompletableFuture.failedFuture(new HivescanTooManyRetriesException(12));
            }
            return CompletableFuture.completedFuture(json(INCOMPLETE));
        }).get());

        assertInstanceOf(HivescanTooManyRetriesException.class, e.getCause());
        assertEquals(3, polls.get());
    }
}
