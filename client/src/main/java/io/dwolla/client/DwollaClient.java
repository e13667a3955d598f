package io.dwolla.client;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.dwolla.client.http.HttpMethod;
import io.dwolla.client.http.MultipartBody;
import io.dwolla.client.http.RequestBody;
import io.dwolla.client.http.RestClient;
import io.dwolla.client.http.RestClientOptions;
import io.dwolla.client.http.RestRequest;
import io.dwolla.client.http.RestResponse;
import io.dwolla.model.DocumentFile;
import io.dwolla.model.Headers;
import io.dwolla.model.UploadDocumentRequest;
import io.dwolla.util.Assert;
import io.dwolla.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for calling the Dwolla v2 API.
 * <p>
 * Each operation builds a {@link RestRequest} carrying exactly the caller's headers plus the
 * content type its verb needs, sends it through the {@link RestClient} transport and turns any
 * failure into a {@link DwollaException}. Every operation comes in two flavours:
 * <ul>
 *   <li>{@code ...Async} returns a {@link CompletableFuture} completed exceptionally with a
 *   {@link DwollaException} on failure</li>
 *   <li>the blocking variant waits for the result and throws the {@link DwollaException}</li>
 * </ul>
 * Responses are parsed into a {@link Class}, or into a {@link TypeReference} for generic
 * types such as {@code List<Customer>}.
 * <pre>{@code
 * DwollaClientConfig config = DwollaClientConfig.fromEnvironment(System.getenv());
 * try (DwollaClient client = DwollaClient.create(config)) {
 *     TokenManager tokens = TokenManager.create(client, config);
 *     RestResponse<Customer> customer = client.get(client.uri("/customers/" + id), Customer.class,
 *             tokens.authorizationHeaders());
 * }
 * }</pre>
 */
public class DwollaClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DwollaClient.class);

    public static final String CONTENT_TYPE = "application/vnd.dwolla.v1.hal+json";
    public static final String AUTH_CONTENT_TYPE = "application/json";
    public static final String UPLOAD_BOUNDARY = "----------Upload";
    public static final String VERSION = "1.0.0";
    public static final String USER_AGENT = "dwolla-v2-java/" + VERSION;

    private final RestClient restClient;
    private final URI apiUrl;

    public DwollaClient(RestClient restClient, URI apiUrl) {
        this.restClient = Assert.checkNotNullParam("restClient", restClient);
        this.apiUrl = Assert.checkNotNullParam("apiUrl", apiUrl);
    }

    public DwollaClient(RestClient restClient) {
        this(restClient, DwollaEnvironment.SANDBOX.getApiUrl());
    }

    public static DwollaClient create(DwollaClientConfig config) {
        return new DwollaClient(createRestClient(config), config.getApiUrl());
    }

    /**
     * Creates the transport described by the configuration, sending the library's
     * {@code User-Agent} and the HAL {@code Accept} header with every request.
     */
    public static RestClient createRestClient(DwollaClientConfig config) {
        Assert.checkNotNullParam("config", config);
        RestClientOptions options = new RestClientOptions(
                Map.of("User-Agent", config.getUserAgent(), "Accept", CONTENT_TYPE),
                config.getConnectTimeout(), config.getRequestTimeout());
        return config.getRestClientBuilder().create(options);
    }

    public URI getApiUrl() {
        return apiUrl;
    }

    /**
     * Resolves a path such as {@code /customers} against the API URL. Absolute URLs, like the
     * {@code href} of a {@link io.dwolla.model.Link}, are returned as is.
     */
    public URI uri(String path) {
        Assert.checkNotNullParam("path", path);
        URI uri = URI.create(path);
        if (uri.isAbsolute()) {
            return uri;
        }
        return URI.create(DwollaEnvironment.stripTrailingSlash(apiUrl.toString()) + (path.startsWith("/") ? path : "/" + path));
    }

    public <T> CompletableFuture<RestResponse<T>> getAsync(URI uri, Class<T> responseType, @Nullable Headers headers) {
        return sendAsync(request(HttpMethod.GET, uri, headers).build(), responseType);
    }

    public <T> RestResponse<T> get(URI uri, Class<T> responseType, @Nullable Headers headers) throws DwollaException {
        return await(getAsync(uri, responseType, headers));
    }

    public <T> CompletableFuture<RestResponse<T>> getAsync(URI uri, TypeReference<T> responseType,
                                                           @Nullable Headers headers) {
        RestRequest request = request(HttpMethod.GET, uri, headers).build();
        return translate(request, restClient.sendAsync(request, responseType));
    }

    public <T> RestResponse<T> get(URI uri, TypeReference<T> responseType, @Nullable Headers headers)
            throws DwollaException {
        return await(getAsync(uri, responseType, headers));
    }

    public <T> CompletableFuture<RestResponse<T>> postAsync(URI uri, Object requestBody, Class<T> responseType,
                                                            @Nullable Headers headers) {
        final RequestBody body;
        try {
            body = json(CONTENT_TYPE, requestBody);
        } catch (DwollaException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sendAsync(request(HttpMethod.POST, uri, headers).body(body).build(), responseType);
    }

    public <T> RestResponse<T> post(URI uri, Object requestBody, Class<T> responseType,
                                    @Nullable Headers headers) throws DwollaException {
        return await(postAsync(uri, requestBody, responseType, headers));
    }

    public <T> CompletableFuture<RestResponse<T>> postAsync(URI uri, Object requestBody, TypeReference<T> responseType,
                                                            @Nullable Headers headers) {
        final RequestBody body;
        try {
            body = json(CONTENT_TYPE, requestBody);
        } catch (DwollaException e) {
            return CompletableFuture.failedFuture(e);
        }
        RestRequest request = request(HttpMethod.POST, uri, headers).body(body).build();
        return translate(request, restClient.sendAsync(request, responseType));
    }

    public <T> RestResponse<T> post(URI uri, Object requestBody, TypeReference<T> responseType,
                                    @Nullable Headers headers) throws DwollaException {
        return await(postAsync(uri, requestBody, responseType, headers));
    }

    /**
     * Posts a request whose response body is of no interest, e.g. a create call answered with
     * {@code 201 Created} and a {@code Location} header.
     */
    public CompletableFuture<RestResponse<Void>> postAsync(URI uri, Object requestBody, @Nullable Headers headers) {
        return postAsync(uri, requestBody, Void.class, headers);
    }

    public RestResponse<Void> post(URI uri, Object requestBody, @Nullable Headers headers) throws DwollaException {
        return await(postAsync(uri, requestBody, headers));
    }

    /**
     * Uploads a document as {@code multipart/form-data} with a {@code documentType} field and a
     * {@code file} part. The document stream is read fully, but not closed.
     */
    public CompletableFuture<RestResponse<Void>> uploadAsync(URI uri, UploadDocumentRequest upload,
                                                             @Nullable Headers headers) {
        Assert.checkNotNullParam("upload", upload);
        DocumentFile document = upload.document();
        final RequestBody body;
        try {
            body = MultipartBody.builder(UPLOAD_BOUNDARY)
                    .addField("documentType", upload.documentType())
                    .addFile("file", document.filename(), document.contentType(), document.stream())
                    .build();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new DwollaException("Could not read document " + document.filename(), e));
        }
        return sendAsync(request(HttpMethod.POST, uri, headers).body(body).build(), Void.class);
    }

    public RestResponse<Void> upload(URI uri, UploadDocumentRequest upload, @Nullable Headers headers)
            throws DwollaException {
        return await(uploadAsync(uri, upload, headers));
    }

    /**
     * Sends a {@code DELETE}, with a JSON body only when {@code requestBody} is not {@code null}.
     */
    public <T> CompletableFuture<RestResponse<T>> deleteAsync(URI uri, @Nullable Object requestBody,
                                                              Class<T> responseType, @Nullable Headers headers) {
        final RestRequest request;
        try {
            request = deleteRequest(uri, requestBody, headers);
        } catch (DwollaException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sendAsync(request, responseType);
    }

    public <T> RestResponse<T> delete(URI uri, @Nullable Object requestBody, Class<T> responseType,
                                      @Nullable Headers headers) throws DwollaException {
        return await(deleteAsync(uri, requestBody, responseType, headers));
    }

    public <T> CompletableFuture<RestResponse<T>> deleteAsync(URI uri, @Nullable Object requestBody,
                                                              TypeReference<T> responseType, @Nullable Headers headers) {
        final RestRequest request;
        try {
            request = deleteRequest(uri, requestBody, headers);
        } catch (DwollaException e) {
            return CompletableFuture.failedFuture(e);
        }
        return translate(request, restClient.sendAsync(request, responseType));
    }

    public <T> RestResponse<T> delete(URI uri, @Nullable Object requestBody, TypeReference<T> responseType,
                                      @Nullable Headers headers) throws DwollaException {
        return await(deleteAsync(uri, requestBody, responseType, headers));
    }

    /**
     * Posts to the token endpoint. Unlike the resource calls this uses plain
     * {@code application/json} and sends no caller headers.
     */
    public <T> CompletableFuture<RestResponse<T>> postAuthAsync(URI uri, Object requestBody, Class<T> responseType) {
        final RequestBody body;
        try {
            body = json(AUTH_CONTENT_TYPE, requestBody);
        } catch (DwollaException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sendAsync(request(HttpMethod.POST, uri, null).body(body).build(), responseType);
    }

    public <T> RestResponse<T> postAuth(URI uri, Object requestBody, Class<T> responseType) throws DwollaException {
        return await(postAuthAsync(uri, requestBody, responseType));
    }

    @Override
    public void close() {
        restClient.close();
    }

    private static RestRequest.Builder request(HttpMethod method, URI uri, @Nullable Headers headers) {
        Assert.checkNotNullParam("uri", uri);
        RestRequest.Builder builder = RestRequest.builder().method(method).uri(uri);
        if (headers != null) {
            builder.addHeaders(headers.asMap());
        }
        return builder;
    }

    private static RestRequest deleteRequest(URI uri, @Nullable Object requestBody, @Nullable Headers headers)
            throws DwollaException {
        RestRequest.Builder builder = request(HttpMethod.DELETE, uri, headers);
        if (requestBody != null) {
            builder.body(json(CONTENT_TYPE, requestBody));
        }
        return builder.build();
    }

    private static RequestBody json(String mediaType, Object value) throws DwollaException {
        Assert.checkNotNullParam("requestBody", value);
        try {
            return RequestBody.utf8(mediaType, Utils.marshal(value));
        } catch (JsonProcessingException e) {
            throw new DwollaException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> CompletableFuture<RestResponse<T>> sendAsync(RestRequest request, Class<T> responseType) {
        return translate(request, restClient.sendAsync(request, responseType));
    }

    private <T> CompletableFuture<RestResponse<T>> translate(RestRequest request,
                                                             CompletableFuture<RestResponse<T>> future) {
        return future
                .thenCompose(new Function<RestResponse<T>, CompletableFuture<RestResponse<T>>>() {
                    @Override
                    public CompletableFuture<RestResponse<T>> apply(RestResponse<T> response) {
                        if (response.success()) {
                            return CompletableFuture.completedFuture(response);
                        }
                        DwollaException exception = DwollaException.create(response);
                        LOGGER.debug("{} failed with status {}: {}", request.resource(), response.statusCode(),
                                exception.getCode());
                        return CompletableFuture.failedFuture(exception);
                    }
                });
    }

    static <T> T await(CompletableFuture<T> future) throws DwollaException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DwollaException("Interrupted while waiting for the API", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DwollaException) {
                throw (DwollaException) cause;
            }
            throw new DwollaException("Request failed", cause != null ? cause : e);
        }
    }
}
