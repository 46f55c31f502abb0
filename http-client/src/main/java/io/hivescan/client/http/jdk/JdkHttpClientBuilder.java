package io.hivescan.client.http.jdk;

import io.hivescan.client.http.HttpClient;
import io.hivescan.client.http.HttpClientBuilder;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url);
    }
}
