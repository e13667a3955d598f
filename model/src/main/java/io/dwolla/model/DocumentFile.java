package io.dwolla.model;

import java.io.InputStream;

import io.dwolla.util.Assert;

/**
 * File content of a document upload. The stream is read once, when the request is built.
 *
 * @param contentType the media type of the file, e.g. {@code image/png}
 * @param filename the file name sent in the part's content disposition
 * @param stream the file content
 */
public record DocumentFile(String contentType, String filename, InputStream stream) {

    public DocumentFile {
        Assert.checkNotBlankParam("contentType", contentType);
        Assert.checkNotBlankParam("filename", filename);
        Assert.checkNotNullParam("stream", stream);
    }
}
