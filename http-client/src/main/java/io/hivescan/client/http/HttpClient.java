package io.hivescan.client.http;

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous HTTP transport bound to a single base URL.
 * <p>
 * Implementations are stateless apart from their connection pool and are safe to share across
 * any number of concurrent requests. Every status code, including 429, is delivered as an
 * {@link HttpResponse}; the returned future only fails when no response was received.
 */
public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(@Nullable Map<String, String> headers);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {
        PostRequestBuilder body(@Nullable String body);

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }
}
