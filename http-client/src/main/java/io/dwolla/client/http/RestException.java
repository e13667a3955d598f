package io.dwolla.client.http;

import org.jspecify.annotations.Nullable;

/**
 * Transport level failure attached to a {@link RestResponse}: a non-2xx status, an I/O error,
 * or a success body that could not be decoded.
 * <p>
 * Transports never throw this; they return it inside the response so the caller decides how
 * to surface it.
 */
public class RestException extends Exception {

    private final int statusCode;
    private final @Nullable String content;

    public RestException(String message, int statusCode, @Nullable String content) {
        super(message);
        this.statusCode = statusCode;
        this.content = content;
    }

    public RestException(String message, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.content = null;
    }

    public RestException(String message, int statusCode, @Nullable String content, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.content = content;
    }

    /**
     * @return the HTTP status, or {@code 0} if no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the raw response body, if a response was received
     */
    public @Nullable String getContent() {
        return content;
    }
}
