package io.dwolla.client.http.vertx;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JavaType;
import io.dwolla.client.http.AbstractRestClient;
import io.dwolla.client.http.RequestBody;
import io.dwolla.client.http.RestClientOptions;
import io.dwolla.client.http.RestRequest;
import io.dwolla.client.http.RestResponse;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link io.dwolla.client.http.RestClient} on top of the Vert.x core {@link HttpClient}.
 * <p>
 * Requests use absolute URIs, so a single instance serves the API host as well as any host a
 * {@code Location} or link points to.
 */
public class VertxRestClient extends AbstractRestClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(VertxRestClient.class);

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final HttpClient client;

    VertxRestClient(RestClientOptions options, Vertx vertx, boolean ownsVertx, HttpClientOptions httpClientOptions) {
        super(options);
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.client = vertx.createHttpClient(new HttpClientOptions(httpClientOptions)
                .setConnectTimeout((int) options.connectTimeout().toMillis()));
    }

    @Override
    protected <T> CompletableFuture<RestResponse<T>> execute(RestRequest request, JavaType responseType) {
        RequestOptions requestOptions = new RequestOptions()
                .setMethod(HttpMethod.valueOf(request.method().name()))
                .setAbsoluteURI(request.uri().toString());
        Duration requestTimeout = getOptions().requestTimeout();
        if (requestTimeout != null) {
            requestOptions.setIdleTimeout(requestTimeout.toMillis());
        }
        for (Map.Entry<String, String> header : headersFor(request).entrySet()) {
            requestOptions.putHeader(header.getKey(), header.getValue());
        }

        LOGGER.debug("Sending {}", request.resource());
        return client.request(requestOptions)
                .compose(new Function<HttpClientRequest, Future<HttpClientResponse>>() {
                    @Override
                    public Future<HttpClientResponse> apply(HttpClientRequest httpRequest) {
                        RequestBody body = request.body();
                        return body == null ? httpRequest.send() : httpRequest.send(Buffer.buffer(body.content()));
                    }
                })
                .compose(new Function<HttpClientResponse, Future<RestResponse<T>>>() {
                    @Override
                    public Future<RestResponse<T>> apply(HttpClientResponse response) {
                        return response.body().map(new Function<Buffer, RestResponse<T>>() {
                            @Override
                            public RestResponse<T> apply(Buffer buffer) {
                                return toRestResponse(request, response.statusCode(), toMap(response.headers()),
                                        buffer.toString(), responseType);
                            }
                        });
                    }
                })
                .toCompletionStage()
                .toCompletableFuture()
                .exceptionally(new Function<Throwable, RestResponse<T>>() {
                    @Override
                    public RestResponse<T> apply(Throwable throwable) {
                        return toFailure(request, throwable);
                    }
                });
    }

    private static Map<String, List<String>> toMap(MultiMap headers) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (String name : headers.names()) {
            map.put(name, new ArrayList<>(headers.getAll(name)));
        }
        return map;
    }

    @Override
    public void close() {
        client.close();
        if (ownsVertx) {
            vertx.close();
        }
    }
}
