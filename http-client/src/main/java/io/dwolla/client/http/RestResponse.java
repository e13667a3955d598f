package io.dwolla.client.http;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.dwolla.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Uniform result of a {@link RestClient} call.
 * <p>
 * Exactly one of two shapes is returned: a successful response with {@code content} parsed
 * into the requested type, or a failed response whose {@code exception} describes what went
 * wrong. Failed responses keep the raw body so error payloads can be inspected.
 *
 * @param request the request that produced this response
 * @param statusCode the HTTP status, or {@code 0} if no response was received
 * @param headers the response headers; lookups are case-insensitive
 * @param content the parsed body, {@code null} for failures, empty bodies and {@link Void} responses
 * @param rawContent the body as received, {@code null} if no response was received
 * @param exception the failure, {@code null} on success
 * @param <T> the content type
 */
public record RestResponse<T>(RestRequest request,
                              int statusCode,
                              Map<String, List<String>> headers,
                              @Nullable T content,
                              @Nullable String rawContent,
                              @Nullable RestException exception) {

    public static final String REQUEST_ID_HEADER = "x-request-id";
    public static final String LOCATION_HEADER = "Location";

    public RestResponse {
        Assert.checkNotNullParam("request", request);
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    copy.put(entry.getKey(), List.copyOf(entry.getValue()));
                }
            }
        }
        headers = Collections.unmodifiableMap(copy);
    }

    public static <T> RestResponse<T> success(RestRequest request, int statusCode,
                                              Map<String, List<String>> headers,
                                              @Nullable T content, @Nullable String rawContent) {
        return new RestResponse<>(request, statusCode, headers, content, rawContent, null);
    }

    public static <T> RestResponse<T> failure(RestRequest request, int statusCode,
                                              Map<String, List<String>> headers,
                                              @Nullable String rawContent, RestException exception) {
        return new RestResponse<>(request, statusCode, headers, null, rawContent,
                Assert.checkNotNullParam("exception", exception));
    }

    public boolean success() {
        return exception == null;
    }

    /**
     * @param name the header name, matched case-insensitively
     * @return the first value of the header, or {@code null} if absent
     */
    public @Nullable String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * @return the {@code x-request-id} correlation id assigned by the API, if present
     */
    public @Nullable String requestId() {
        return header(REQUEST_ID_HEADER);
    }

    /**
     * @return the {@code Location} of a created resource, resolved against the request URI
     */
    public @Nullable URI location() {
        String location = header(LOCATION_HEADER);
        return location == null ? null : request.uri().resolve(location);
    }
}
