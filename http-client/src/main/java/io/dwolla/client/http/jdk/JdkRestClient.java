package io.dwolla.client.http.jdk;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

import com.fasterxml.jackson.databind.JavaType;
import io.dwolla.client.http.AbstractRestClient;
import io.dwolla.client.http.RequestBody;
import io.dwolla.client.http.RestClientOptions;
import io.dwolla.client.http.RestRequest;
import io.dwolla.client.http.RestResponse;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link io.dwolla.client.http.RestClient} on top of {@link java.net.http.HttpClient}.
 */
class JdkRestClient extends AbstractRestClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkRestClient.class);

    private final HttpClient httpClient;

    JdkRestClient(RestClientOptions options) {
        super(options);
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(options.connectTimeout())
                .build();
    }

    @Override
    protected <T> CompletableFuture<RestResponse<T>> execute(RestRequest request, JavaType responseType) {
        final HttpRequest httpRequest;
        try {
            httpRequest = createRequest(request);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(toFailure(request, e));
        }

        LOGGER.debug("Sending {}", request.resource());
        return httpClient
                .sendAsync(httpRequest, BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle(new BiFunction<HttpResponse<String>, Throwable, RestResponse<T>>() {
                    @Override
                    public RestResponse<T> apply(HttpResponse<String> response, @Nullable Throwable throwable) {
                        if (throwable != null) {
                            return toFailure(request, throwable);
                        }
                        return toRestResponse(request, response.statusCode(), response.headers().map(),
                                response.body(), responseType);
                    }
                });
    }

    private HttpRequest createRequest(RestRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(request.uri());
        Duration requestTimeout = getOptions().requestTimeout();
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        for (Map.Entry<String, String> header : headersFor(request).entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        RequestBody body = request.body();
        switch (request.method()) {
            case GET:
                return builder.GET().build();
            case POST:
                return builder.POST(publisherOf(body)).build();
            case DELETE:
                return body == null ? builder.DELETE().build() : builder.method("DELETE", publisherOf(body)).build();
            default:
                throw new IllegalArgumentException("Unsupported method " + request.method());
        }
    }

    private static BodyPublisher publisherOf(@Nullable RequestBody body) {
        return body == null ? BodyPublishers.noBody() : BodyPublishers.ofByteArray(body.content());
    }
}
