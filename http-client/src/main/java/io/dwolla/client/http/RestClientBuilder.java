package io.dwolla.client.http;

import io.dwolla.client.http.jdk.JdkRestClientBuilder;

/**
 * Factory for {@link RestClient} implementations.
 */
public interface RestClientBuilder {

    RestClientBuilder DEFAULT_FACTORY = new JdkRestClientBuilder();

    RestClient create(RestClientOptions options);
}
