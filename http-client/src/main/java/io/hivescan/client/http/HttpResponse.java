package io.hivescan.client.http;

import java.util.List;
import java.util.Map;

public interface HttpResponse {

    int HTTP_TOO_MANY_REQUESTS = 429;

    int statusCode();

    /**
     * @return the response headers; names are as received, lookups should be case-insensitive
     */
    Map<String, List<String>> headers();

    String body();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * @return {@code true} if the server asked the client to slow down and retry later
     */
    default boolean rateLimited() {
        return statusCode() == HTTP_TOO_MANY_REQUESTS;
    }
}
