package io.hivescan.client.fanout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class OrderedFanOutTest {

    private static final Map<String, Long> LATENCIES = Map.of("a", 30L, "b", 10L, "c", 20L);

    private static CompletableFuture<List<String>> delayedColumns(String item) {
        return CompletableFuture.supplyAsync(() -> List.of(item + "-1", item + "-2"),
                CompletableFuture.delayedExecutor(LATENCIES.getOrDefault(item, 0L), TimeUnit.MILLISECONDS));
    }

    @Test
    public void testDeliversInInputOrder() throws Exception {
        List<String> delivered = Collections.synchronizedList(new ArrayList<>());
        OrderedFanOut<String, List<String>> fanOut = new OrderedFanOut<>(List::of);

        fanOut.aggregate(List.of("a", "b", "c"), OrderedFanOutTest::delayedColumns,
                (item, columns) -> delivered.add(item + "=" + columns)).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("a=[a-1, a-2]", "b=[b-1, b-2]", "c=[c-1, c-2]"), delivered);
    }

    @Test
    public void testStartsEveryFetchBeforeAnyCompletes() throws Exception {
        AtomicInteger started = new AtomicInteger();
        CompletableFuture<Void> gate = new CompletableFuture<>();
        OrderedFanOut<String, String> fanOut = new OrderedFanOut<>(() -> "");

        CompletableFuture<List<FetchOutcome<String, String>>> result = fanOut.collect(List.of("a", "b", "c"), item -> {
            started.incrementAndGet();
            return gate.thenApply(v -> item.toUpperCase());
        });

        assertEquals(3, started.get());
        assertFalse(result.isDone());
        gate.complete(null);

        List<FetchOutcome<String, String>> outcomes = result.get(5, TimeUnit.SECONDS);
        assertEquals(List.of("A", "B", "C"), outcomes.stream().map(FetchOutcome::value).toList());
    }

    @Test
    public void testFailedFetchDeliversPlaceholder() throws Exception {
        List<String> delivered = new ArrayList<>();
        OrderedFanOut<String, List<String>> fanOut = new OrderedFanOut<>(List::of);

        fanOut.aggregate(List.of("a", "broken", "c"), item -> {
            if (item.equals("broken")) {
                return CompletableFuture.failedFuture(new IllegalStateException("boom"));
            }
            return delayedColumns(item);
        }, (item, columns) -> delivered.add(item + "=" + columns)).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("a=[a-1, a-2]", "broken=[]", "c=[c-1, c-2]"), delivered);
    }

    @Test
    public void testCollectRecordsFailure() throws Exception {
        OrderedFanOut<String, String> fanOut = new OrderedFanOut<>(() -> "none");

        List<FetchOutcome<String, String>> outcomes = fanOut.collect(List.of("ok", "throws"), item -> {
            if (item.equals("throws")) {
                throw new IllegalArgumentException("bad item");
            }
            return CompletableFuture.completedFuture(item);
        }).get();

        assertTrue(outcomes.get(0).success());
        assertNull(outcomes.get(0).failure());
        assertFalse(outcomes.get(1).success());
        assertEquals("none", outcomes.get(1).value());
        assertInstanceOf(IllegalArgumentException.class, outcomes.get(1).failure());
    }

    @Test
    public void testEmptyInput() throws Exception {
        List<String> delivered = new ArrayList<>();
        OrderedFanOut<String, String> fanOut = new OrderedFanOut<>(() -> "");

        fanOut.aggregate(List.of(), CompletableFuture::completedFuture, (item, value) -> delivered.add(item)).get();

        assertTrue(delivered.isEmpty());
    }

    @Test
    public void testConsumerFailureFailsAggregation() {
        List<String> delivered = new ArrayList<>();
        OrderedFanOut<String, String> fanOut = new OrderedFanOut<>(() -> "");

        ExecutionException e = assertThrows(ExecutionException.class, () -> fanOut.aggregate(List.of("a", "b", "c"),
                CompletableFuture::completedFuture, (item, value) -> {
                    if (item.equals("b")) {
                        throw new IllegalStateException("consumer failed");
                    }
                    delivered.add(item);
                }).get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(List.of("a"), delivered);
    }

    @Test
    public void testNullPlaceholderFailsAggregation() {
        OrderedFanOut<String, String> fanOut = new OrderedFanOut<>(() -> null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> fanOut.collect(List.of("a"),
                item -> CompletableFuture.failedFuture(new IllegalStateException("boom"))).get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
