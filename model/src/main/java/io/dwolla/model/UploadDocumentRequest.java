package io.dwolla.model;

import io.dwolla.util.Assert;

/**
 * Multipart upload of a verification document to {@code POST /customers/{id}/documents}.
 *
 * @param documentType {@code passport}, {@code license}, {@code idCard} or {@code other}
 * @param document the file to upload
 */
public record UploadDocumentRequest(String documentType, DocumentFile document) {

    public UploadDocumentRequest {
        Assert.checkNotBlankParam("documentType", documentType);
        Assert.checkNotNullParam("document", document);
    }
}
