package io.dwolla.client.http;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.dwolla.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A fully prepared request handed to a {@link RestClient}.
 * <p>
 * The headers are the caller supplied ones, in order. The {@code Content-Type} of the body is
 * carried by {@link RequestBody} and applied by the transport.
 *
 * @param method the HTTP method
 * @param uri the absolute request URI
 * @param headers the request headers, insertion ordered and unmodifiable
 * @param body the request body, or {@code null} for none
 */
public record RestRequest(HttpMethod method, URI uri, Map<String, String> headers, @Nullable RequestBody body) {

    public RestRequest {
        Assert.checkNotNullParam("method", method);
        Assert.checkNotNullParam("uri", uri);
        if (!uri.isAbsolute()) {
            throw new IllegalArgumentException("Request URI must be absolute: " + uri);
        }
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * @return {@code "METHOD uri"}, the form used in log and error messages
     */
    public String resource() {
        return method + " " + uri;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private @Nullable HttpMethod method;
        private @Nullable URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable RequestBody body;

        private Builder() {
        }

        public Builder method(HttpMethod method) {
            this.method = method;
            return this;
        }

        public Builder uri(URI uri) {
            this.uri = uri;
            return this;
        }

        public Builder addHeader(String name, String value) {
            headers.put(Assert.checkNotNullParam("name", name), Assert.checkNotNullParam("value", value));
            return this;
        }

        public Builder addHeaders(@Nullable Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return this;
        }

        public Builder body(@Nullable RequestBody body) {
            this.body = body;
            return this;
        }

        public RestRequest build() {
            return new RestRequest(
                    Assert.checkNotNullParam("method", method),
                    Assert.checkNotNullParam("uri", uri),
                    headers,
                    body);
        }
    }
}
