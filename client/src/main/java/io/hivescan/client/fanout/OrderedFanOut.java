package io.hivescan.client.fanout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import io.hivescan.util.Assert;

/**
 * Runs one fetch per item concurrently and hands the results over in input order.
 * <p>
 * Every fetch is started immediately, there is no concurrency cap, so callers are expected to
 * bound the size of the input themselves. Results that complete early are held back until
 * every item before them has been delivered. The consumer is invoked by one thread at a time.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * OrderedFanOut<String, List<Column>> fanOut = new OrderedFanOut<>(List::of);
 * fanOut.aggregate(datasetSlugs, client::listAllColumns,
 *         (dataset, columns) -> System.out.println(dataset + ": " + columns.size()))
 *     .join();
 * }</pre>
 *
 * @param <W> the work item type
 * @param <T> the fetched value type
 */
public class OrderedFanOut<W, T> {

    private final Supplier<T> placeholder;

    /**
     * @param placeholder supplies the value delivered for an item whose fetch failed, typically an empty collection
     */
    public OrderedFanOut(Supplier<T> placeholder) {
        this.placeholder = Assert.checkNotNullParam("placeholder", placeholder);
    }

    /**
     * Fetches every item and passes each (item, value) pair to the consumer in input order.
     *
     * @param items the work items, in the order results must be delivered
     * @param fetch starts the fetch for one item
     * @param consumer receives the results; a failed item is delivered with the placeholder
     * @return a future completing once every item has been delivered, or exceptionally if the consumer threw
     */
    public CompletableFuture<Void> aggregate(List<W> items, Function<W, CompletableFuture<T>> fetch,
                                             BiConsumer<W, T> consumer) {
        Assert.checkNotNullParam("consumer", consumer);
        return deliverInOrder(items, fetch, outcome -> consumer.accept(outcome.item(), outcome.value()));
    }

    /**
     * Fetches every item and returns the outcomes in input order.
     *
     * @param items the work items
     * @param fetch starts the fetch for one item
     * @return one outcome per item, in input order
     */
    public CompletableFuture<List<FetchOutcome<W, T>>> collect(List<W> items, Function<W, CompletableFuture<T>> fetch) {
        List<FetchOutcome<W, T>> outcomes = new ArrayList<>(items.size());
        return deliverInOrder(items, fetch, outcomes::add)
                .thenApply(v -> Collections.unmodifiableList(outcomes));
    }

    private CompletableFuture<Void> deliverInOrder(List<W> items, Function<W, CompletableFuture<T>> fetch,
                                                   Consumer<FetchOutcome<W, T>> sink) {
        Assert.checkNotNullParam("items", items);
        Assert.checkNotNullParam("fetch", fetch);

        List<CompletableFuture<FetchOutcome<W, T>>> inFlight = new ArrayList<>(items.size());
        for (W item : items) {
            inFlight.add(Fetches.launch(item, fetch, placeholder));
        }

        // each delivery waits for the previous one, so the sink sees input order
        CompletableFuture<Void> delivered = CompletableFuture.completedFuture(null);
        for (CompletableFuture<FetchOutcome<W, T>> outcome : inFlight) {
            delivered = delivered.thenCompose(v -> outcome).thenAccept(sink);
        }
        return delivered;
    }
}
