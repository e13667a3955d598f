package io.dwolla.client.http.vertx;

import io.dwolla.client.http.RestClient;
import io.dwolla.client.http.RestClientBuilder;
import io.dwolla.client.http.RestClientOptions;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import org.jspecify.annotations.Nullable;

/**
 * Creates {@link VertxRestClient}s. Without an explicit {@link Vertx} instance each client starts,
 * and on close stops, its own.
 */
public class VertxRestClientBuilder implements RestClientBuilder {

    private @Nullable Vertx vertx;

    private @Nullable HttpClientOptions options;

    public VertxRestClientBuilder vertx(Vertx vertx) {
        this.vertx = vertx;
        return this;
    }

    public VertxRestClientBuilder options(HttpClientOptions options) {
        this.options = options;
        return this;
    }

    @Override
    public RestClient create(RestClientOptions restClientOptions) {
        return new VertxRestClient(restClientOptions,
                vertx != null ? vertx : Vertx.vertx(),
                vertx == null,
                options != null ? options : new HttpClientOptions());
    }
}
