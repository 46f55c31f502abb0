package io.hivescan.client.http.jdk;

import io.hivescan.client.http.HttpClient;
import io.hivescan.client.http.HttpResponse;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdkHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        this.httpClient = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_2)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT)
                .build();

        URL targetUrl = buildUrl(baseUrl);
        String basePath = targetUrl.getPath();
        while (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority() + basePath;
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        protected URLConnection openConnection(URL u) {
            return null;
        }
    };

    private static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException var2) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid");
        }
    }

    URI resolve(String path) {
        if (path.isEmpty() || path.startsWith("/")) {
            return URI.create(baseUrl + path);
        }
        return URI.create(baseUrl + "/" + path);
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new HashMap<>();

        public JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(@Nullable Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(resolve(path));
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder;
        }

        protected CompletableFuture<HttpResponse> send(HttpRequest request) {
            LOGGER.debug("{} {}", request.method(), request.uri());
            return httpClient
                    .sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenApply(RESPONSE_MAPPER);
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        public JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return send(super.createRequestBuilder().GET().build());
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        String body = "";

        public JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PostRequestBuilder body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return send(super.createRequestBuilder()
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build());
        }
    }

    private final static Function<java.net.http.HttpResponse<String>, HttpResponse> RESPONSE_MAPPER = response -> {
        LOGGER.debug("{} {} -> {}", response.request().method(), response.uri(), response.statusCode());
        return new JdkHttpResponse(response);
    };

    private record JdkHttpResponse(java.net.http.HttpResponse<String> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Map<String, List<String>> headers() {
            return response.headers().map();
        }

        @Override
        public String body() {
            String body = response.body();
            return body == null ? "" : body;
        }
    }
}
