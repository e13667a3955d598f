package io.dwolla.client.http;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.dwolla.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Settings a {@link RestClientBuilder} creates a transport with.
 *
 * @param defaultHeaders headers sent with every request, before the request's own headers
 * @param connectTimeout maximum time to establish a connection
 * @param requestTimeout maximum time to wait for a response, or {@code null} for no limit
 */
public record RestClientOptions(Map<String, String> defaultHeaders,
                                Duration connectTimeout,
                                @Nullable Duration requestTimeout) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public RestClientOptions {
        defaultHeaders = defaultHeaders == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(defaultHeaders));
        Assert.checkNotNullParam("connectTimeout", connectTimeout);
    }

    public static RestClientOptions defaults() {
        return new RestClientOptions(Map.of(), DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }

    public RestClientOptions withDefaultHeaders(Map<String, String> headers) {
        return new RestClientOptions(headers, connectTimeout, requestTimeout);
    }
}
