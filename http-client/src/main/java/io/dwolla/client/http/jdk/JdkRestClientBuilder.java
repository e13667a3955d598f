package io.dwolla.client.http.jdk;

import io.dwolla.client.http.RestClient;
import io.dwolla.client.http.RestClientBuilder;
import io.dwolla.client.http.RestClientOptions;

public class JdkRestClientBuilder implements RestClientBuilder {

    @Override
    public RestClient create(RestClientOptions options) {
        return new JdkRestClient(options);
    }
}
