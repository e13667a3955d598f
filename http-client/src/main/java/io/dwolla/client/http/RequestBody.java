package io.dwolla.client.http;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import io.dwolla.util.Assert;

/**
 * Encoded body of an outgoing request together with its {@code Content-Type}.
 */
public final class RequestBody {

    private final String contentType;
    private final byte[] content;

    public RequestBody(String contentType, byte[] content) {
        this.contentType = Assert.checkNotNullParam("contentType", contentType);
        this.content = Assert.checkNotNullParam("content", content).clone();
    }

    /**
     * Creates a UTF-8 encoded text body. The charset is appended to the media type.
     *
     * @param mediaType the media type without parameters, e.g. {@code application/json}
     * @param text the body text
     * @return the body
     */
    public static RequestBody utf8(String mediaType, String text) {
        return new RequestBody(mediaType + "; charset=utf-8", text.getBytes(StandardCharsets.UTF_8));
    }

    public String contentType() {
        return contentType;
    }

    public byte[] content() {
        return content.clone();
    }

    public int length() {
        return content.length;
    }

    /**
     * @return the body decoded as UTF-8
     */
    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestBody that = (RequestBody) o;
        return contentType.equals(that.contentType) && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * contentType.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "RequestBody[contentType=" + contentType + ", length=" + content.length + "]";
    }
}
