package io.dwolla.client.http;

import static java.net.HttpURLConnection.HTTP_MULT_CHOICE;
import static java.net.HttpURLConnection.HTTP_OK;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.dwolla.util.Assert;
import io.dwolla.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for transports: default header merging and the mapping of raw HTTP results
 * onto {@link RestResponse}. Both {@code sendAsync} flavours resolve the response type to a
 * Jackson {@link JavaType} and hand over to {@link #execute(RestRequest, JavaType)}.
 */
public abstract class AbstractRestClient implements RestClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractRestClient.class);

    protected static final String CONTENT_TYPE = "Content-Type";

    private final RestClientOptions options;

    protected AbstractRestClient(RestClientOptions options) {
        this.options = Assert.checkNotNullParam("options", options);
    }

    public RestClientOptions getOptions() {
        return options;
    }

    @Override
    public final <T> CompletableFuture<RestResponse<T>> sendAsync(RestRequest request, Class<T> responseType) {
        Assert.checkNotNullParam("responseType", responseType);
        return execute(request, Utils.OBJECT_MAPPER.constructType(responseType));
    }

    @Override
    public final <T> CompletableFuture<RestResponse<T>> sendAsync(RestRequest request, TypeReference<T> responseType) {
        Assert.checkNotNullParam("responseType", responseType);
        return execute(request, Utils.OBJECT_MAPPER.constructType(responseType));
    }

    /**
     * Sends the request and maps the outcome with {@link #toRestResponse} or {@link #toFailure}.
     * The returned future must not complete exceptionally.
     *
     * @param responseType the type a successful body is parsed into, matching {@code T}
     */
    protected abstract <T> CompletableFuture<RestResponse<T>> execute(RestRequest request, JavaType responseType);

    /**
     * Header names are matched case-insensitively: a later header replaces an earlier one with
     * the same name and takes its place at the end.
     *
     * @return the default headers followed by the request headers, then the body content type
     */
    protected Map<String, String> headersFor(RestRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        options.defaultHeaders().forEach((name, value) -> putHeader(headers, name, value));
        request.headers().forEach((name, value) -> putHeader(headers, name, value));
        RequestBody body = request.body();
        if (body != null) {
            putHeader(headers, CONTENT_TYPE, body.contentType());
        }
        return headers;
    }

    private static void putHeader(Map<String, String> headers, String name, String value) {
        headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
        headers.put(name, value);
    }

    /**
     * Maps a received HTTP response. A 2xx status yields the parsed content; anything else
     * yields a failed response that keeps the raw body.
     */
    @SuppressWarnings("unchecked")
    protected <T> RestResponse<T> toRestResponse(RestRequest request, int statusCode,
                                                 Map<String, List<String>> headers,
                                                 @Nullable String body, JavaType responseType) {
        LOGGER.debug("{} returned {}", request.resource(), statusCode);

        if (!isSuccessStatus(statusCode)) {
            return RestResponse.failure(request, statusCode, headers, body,
                    new RestException("Request failed: status[" + statusCode + "]", statusCode, body));
        }

        if (responseType.hasRawClass(Void.class) || body == null || body.isBlank()) {
            return RestResponse.success(request, statusCode, headers, null, body);
        }

        if (responseType.hasRawClass(String.class)) {
            return RestResponse.success(request, statusCode, headers, (T) body, body);
        }

        try {
            T content = Utils.unmarshalFrom(body, responseType);
            return RestResponse.success(request, statusCode, headers, content, body);
        } catch (JsonProcessingException e) {
            String typeName = typeName(responseType);
            LOGGER.warn("Could not decode {} response of {}", typeName, request.resource());
            return RestResponse.failure(request, statusCode, headers, body,
                    new RestException("Could not decode response as " + typeName, statusCode, body, e));
        }
    }

    /**
     * Maps a request that produced no HTTP response at all, e.g. a connection failure.
     */
    protected <T> RestResponse<T> toFailure(RestRequest request, Throwable throwable) {
        Throwable cause = unwrap(throwable);
        LOGGER.warn("{} failed: {}", request.resource(), cause.toString());
        return RestResponse.failure(request, 0, Map.of(), null,
                new RestException("Request failed: " + cause.getMessage(), cause));
    }

    private static String typeName(JavaType type) {
        return type.containedTypeCount() == 0 ? type.getRawClass().getSimpleName() : type.toCanonical();
    }

    protected static boolean isSuccessStatus(int statusCode) {
        return statusCode >= HTTP_OK && statusCode < HTTP_MULT_CHOICE;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
