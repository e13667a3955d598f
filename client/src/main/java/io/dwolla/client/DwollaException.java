package io.dwolla.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.dwolla.client.http.RestResponse;
import io.dwolla.model.ErrorResponse;
import io.dwolla.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Raised when a call to the Dwolla API does not succeed.
 * <p>
 * Covers three situations:
 * <ul>
 *   <li>the request never got a response (connection refused, timeout): {@link #getStatusCode()} is {@code 0}</li>
 *   <li>the API answered with an error payload: {@link #getError()} exposes its code and message</li>
 *   <li>the API answered with a body that is not an error payload: only {@link #getContent()} is available</li>
 * </ul>
 * The message always names the resource and the {@code x-request-id} the API assigned, so that failures
 * can be correlated with Dwolla support.
 */
public class DwollaException extends Exception {

    private final @Nullable RestResponse<?> response;
    private final @Nullable ErrorResponse error;

    /**
     * Creates an exception for a failure that happened before a request could be sent.
     *
     * @param msg the exception message
     * @param cause the underlying cause
     */
    public DwollaException(final String msg, final Throwable cause) {
        super(msg, cause);
        this.response = null;
        this.error = null;
    }

    /**
     * Creates an exception for a failed response.
     *
     * @param msg the exception message
     * @param response the failed response
     * @param error the parsed error payload, if the body was one
     */
    public DwollaException(final String msg, final RestResponse<?> response, @Nullable final ErrorResponse error) {
        super(msg, response.exception());
        this.response = response;
        this.error = error;
    }

    /**
     * Translates a failed transport response.
     *
     * @param response a response whose {@link RestResponse#exception()} is set
     * @return the exception to throw
     */
    public static DwollaException create(RestResponse<?> response) {
        String requestId = Utils.defaultIfNull(response.requestId(), "");
        String message = "API Error, Resource=\"" + response.request().resource() + "\", RequestId=\"" + requestId + "\"";
        return new DwollaException(message, response, parseError(response.rawContent()));
    }

    static @Nullable ErrorResponse parseError(@Nullable String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        try {
            ErrorResponse error = Utils.unmarshalFrom(content, ErrorResponse.class);
            return error == null || error.code() == null ? null : error;
        } catch (JsonProcessingException e) {
            // not an error payload, the raw content is still exposed
            return null;
        }
    }

    public @Nullable RestResponse<?> getResponse() {
        return response;
    }

    /**
     * @return the parsed error payload, or {@code null} if the body was not one
     */
    public @Nullable ErrorResponse getError() {
        return error;
    }

    /**
     * @return the error code of the payload, e.g. {@code ExpiredAccessToken}
     */
    public @Nullable String getCode() {
        return error == null ? null : error.code();
    }

    /**
     * @return the raw response body
     */
    public @Nullable String getContent() {
        return response == null ? null : response.rawContent();
    }

    public @Nullable String getRequestId() {
        return response == null ? null : response.requestId();
    }

    /**
     * @return the HTTP status, or {@code 0} if no response was received
     */
    public int getStatusCode() {
        return response == null ? 0 : response.statusCode();
    }
}
