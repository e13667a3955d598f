package io.dwolla.client.http;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Transport that sends prepared {@link RestRequest}s and returns {@link RestResponse}s.
 * <p>
 * Implementations report HTTP and I/O failures inside the returned response rather than
 * completing the future exceptionally, so every call yields either parsed content or the raw
 * failure context. The transport applies its default headers (typically {@code User-Agent}
 * and {@code Accept}) before the request's own headers.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RestClient restClient = RestClientBuilder.DEFAULT_FACTORY.create(RestClientOptions.defaults());
 *
 * RestRequest request = RestRequest.builder()
 *     .method(HttpMethod.GET)
 *     .uri(URI.create("https://api-sandbox.dwolla.com/"))
 *     .addHeader("Authorization", "Bearer " + token)
 *     .build();
 *
 * RestResponse<RootResponse> response = restClient.send(request, RootResponse.class);
 * if (response.success()) {
 *     RootResponse root = response.content();
 * }
 * }</pre>
 *
 * @see RestClientBuilder
 */
public interface RestClient extends AutoCloseable {

    /**
     * Sends a request asynchronously.
     *
     * @param request the request to send
     * @param responseType the type to parse a successful body into; {@link Void} skips parsing,
     *                     {@link String} returns the body unparsed
     * @param <T> the content type
     * @return a future completed with the response, successful or not
     */
    <T> CompletableFuture<RestResponse<T>> sendAsync(RestRequest request, Class<T> responseType);

    /**
     * Sends a request asynchronously, parsing a successful body into a generic type such as
     * {@code new TypeReference<List<Customer>>() {}}.
     *
     * @param request the request to send
     * @param responseType the type to parse a successful body into
     * @param <T> the content type
     * @return a future completed with the response, successful or not
     */
    <T> CompletableFuture<RestResponse<T>> sendAsync(RestRequest request, TypeReference<T> responseType);

    /**
     * Sends a request and waits for the response.
     *
     * @param request the request to send
     * @param responseType the type to parse a successful body into; {@link Void} skips parsing,
     *                     {@link String} returns the body unparsed
     * @param <T> the content type
     * @return the response, successful or not
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    default <T> RestResponse<T> send(RestRequest request, Class<T> responseType) throws InterruptedException {
        return await(request, sendAsync(request, responseType));
    }

    /**
     * Sends a request and waits for the response, parsing a successful body into a generic type.
     *
     * @param request the request to send
     * @param responseType the type to parse a successful body into
     * @param <T> the content type
     * @return the response, successful or not
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    default <T> RestResponse<T> send(RestRequest request, TypeReference<T> responseType) throws InterruptedException {
        return await(request, sendAsync(request, responseType));
    }

    /**
     * Releases resources held by the transport. The default does nothing.
     */
    @Override
    default void close() {
    }

    private static <T> RestResponse<T> await(RestRequest request, CompletableFuture<RestResponse<T>> future)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException | CancellationException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            return RestResponse.failure(request, 0, Map.of(), null,
                    new RestException("Request failed: " + cause.getMessage(), cause));
        }
    }
}
