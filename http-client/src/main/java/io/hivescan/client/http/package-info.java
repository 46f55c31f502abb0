/**
 * Transport layer of the hivescan client.
 *
 * <p>This package provides a pluggable, asynchronous HTTP abstraction. The orchestration
 * code only ever talks to {@link io.hivescan.client.http.HttpClient}; the default
 * implementation is backed by the JDK {@code java.net.http} client.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.hivescan.client.http.HttpClient} - request builders returning {@code CompletableFuture}s</li>
 *   <li>{@link io.hivescan.client.http.HttpResponse} - status, headers and body of a received response</li>
 *   <li>{@link io.hivescan.client.http.HttpClientBuilder} - creates clients; {@code DEFAULT_FACTORY} is JDK based</li>
 *   <li>{@link io.hivescan.client.http.HttpClientManager} - one shared client per endpoint</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("https://api.honeycomb.io");
 * HttpResponse response = client.get("/1/datasets")
 *     .addHeader("X-Honeycomb-Team", apiKey)
 *     .send()
 *     .join();
 *
 * if (response.rateLimited()) {
 *     // back off and try again
 * }
 * }</pre>
 */
@NullMarked
package io.hivescan.client.http;

import org.jspecify.annotations.NullMarked;
