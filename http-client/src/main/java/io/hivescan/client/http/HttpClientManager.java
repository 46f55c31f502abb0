package io.hivescan.client.http;

import io.hivescan.util.Assert;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link HttpClient} per API root, so every fetch of a fan-out shares the same
 * connection pool instead of opening its own. An API root is the scheme, host, port and base
 * path of the URL; trailing slashes and default ports do not make a difference.
 */
public class HttpClientManager {

    private final Map<Endpoint, HttpClient> clients = new ConcurrentHashMap<>();
    private final HttpClientBuilder clientBuilder;

    public HttpClientManager() {
        this(HttpClientBuilder.DEFAULT_FACTORY);
    }

    public HttpClientManager(HttpClientBuilder clientBuilder) {
        this.clientBuilder = Assert.checkNotNullParam("clientBuilder", clientBuilder);
    }

    public HttpClient getOrCreate(String url) {
        Assert.checkNotNullParam("url", url);
        return clients.computeIfAbsent(Endpoint.from(url), endpoint -> clientBuilder.create(url));
    }

    private record Endpoint(String scheme, String host, int port, String path) {

        static Endpoint from(String url) {
            URL parsed;
            try {
                parsed = URI.create(url).toURL();
            } catch (MalformedURLException | IllegalArgumentException ex) {
                throw new IllegalArgumentException("URL is malformed: [" + url + "]", ex);
            }
            String path = parsed.getPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            int port = parsed.getPort() != -1 ? parsed.getPort() : parsed.getDefaultPort();
            return new Endpoint(parsed.getProtocol(), parsed.getHost().toLowerCase(Locale.ROOT), port, path);
        }
    }
}
