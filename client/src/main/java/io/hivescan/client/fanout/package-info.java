/**
 * Fan-out aggregation: one fetch per work item, run concurrently, collected into one
 * {@link io.hivescan.client.fanout.FetchOutcome} per item.
 *
 * <p>Two strategies are provided:
 * <ul>
 *   <li>{@link io.hivescan.client.fanout.OrderedFanOut} - starts every fetch at once and delivers
 *       results in input order</li>
 *   <li>{@link io.hivescan.client.fanout.BoundedFanOut} - caps the number of fetches in flight and
 *       collects results in completion order, reporting progress to a
 *       {@link io.hivescan.client.fanout.ProgressSink}</li>
 * </ul>
 *
 * <p>Neither strategy ever fails as a whole because of one item. A failed fetch is logged and
 * recorded on its outcome, and a placeholder value is used in its place.
 */
@NullMarked
package io.hivescan.client.fanout;

import org.jspecify.annotations.NullMarked;
