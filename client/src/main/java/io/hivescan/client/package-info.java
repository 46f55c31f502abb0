/**
 * The Honeycomb API client and the request machinery behind it.
 *
 * <p>{@link io.hivescan.client.HoneycombClient} maps API operations onto HTTP requests. Each request
 * runs through a {@link io.hivescan.client.RetryingRequestExecutor}, which absorbs rate limiting,
 * and query results are awaited with a {@link io.hivescan.client.QueryResultPoller}.
 */
@NullMarked
package io.hivescan.client;

import org.jspecify.annotations.NullMarked;
