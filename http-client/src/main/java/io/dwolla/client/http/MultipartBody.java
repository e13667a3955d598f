package io.dwolla.client.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import io.dwolla.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Encoder for {@code multipart/form-data} request bodies.
 *
 * <pre>{@code
 * RequestBody body = MultipartBody.builder("----------Upload")
 *     .addField("documentType", "passport")
 *     .addFile("file", "passport.png", "image/png", inputStream)
 *     .build();
 * }</pre>
 */
public final class MultipartBody {

    public static final String MULTIPART_FORM_DATA = "multipart/form-data";

    private static final String CRLF = "\r\n";
    private static final String TEXT_PLAIN = "text/plain; charset=utf-8";

    private MultipartBody() {
    }

    public static Builder builder(String boundary) {
        return new Builder(boundary);
    }

    /**
     * @return the {@code Content-Type} header value for the given boundary
     */
    public static String contentType(String boundary) {
        return MULTIPART_FORM_DATA + "; boundary=\"" + boundary + "\"";
    }

    private record Part(String name, @Nullable String filename, String contentType, byte[] content) {
    }

    public static class Builder {
        private final String boundary;
        private final List<Part> parts = new ArrayList<>();

        private Builder(String boundary) {
            this.boundary = Assert.checkNotBlankParam("boundary", boundary);
        }

        public Builder addField(String name, String value) {
            Assert.checkNotNullParam("value", value);
            parts.add(new Part(Assert.checkNotBlankParam("name", name), null, TEXT_PLAIN,
                    value.getBytes(StandardCharsets.UTF_8)));
            return this;
        }

        /**
         * Adds a file part. The stream is read fully but not closed.
         *
         * @throws IOException if the stream cannot be read
         */
        public Builder addFile(String name, String filename, String contentType, InputStream content) throws IOException {
            Assert.checkNotNullParam("content", content);
            parts.add(new Part(Assert.checkNotBlankParam("name", name),
                    Assert.checkNotBlankParam("filename", filename),
                    checkContentType(contentType),
                    content.readAllBytes()));
            return this;
        }

        private static String checkContentType(String contentType) {
            Assert.checkNotBlankParam("contentType", contentType);
            if (contentType.indexOf('\r') >= 0 || contentType.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("Parameter 'contentType' may not contain line breaks");
            }
            return contentType;
        }

        public RequestBody build() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            for (Part part : parts) {
                write(out, "--" + boundary + CRLF);
                write(out, "Content-Type: " + part.contentType() + CRLF);
                write(out, "Content-Disposition: form-data; name=\"" + escape(part.name()) + "\"");
                if (part.filename() != null) {
                    write(out, "; filename=\"" + escape(part.filename()) + "\"");
                }
                write(out, CRLF + CRLF);
                out.writeBytes(part.content());
                write(out, CRLF);
            }
            write(out, "--" + boundary + "--" + CRLF);
            return new RequestBody(contentType(boundary), out.toByteArray());
        }

        /**
         * Percent-encodes the characters that would end a quoted parameter or the header line,
         * as browsers do for form-data names.
         */
        private static String escape(String value) {
            return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
        }

        private static void write(ByteArrayOutputStream out, String text) {
            out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
        }
    }
}
