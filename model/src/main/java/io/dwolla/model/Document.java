package io.dwolla.model;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * An identity document uploaded for customer verification.
 *
 * @param links related resources
 * @param id the document id
 * @param status {@code pending} or {@code reviewed}
 * @param type {@code passport}, {@code license}, {@code idCard} or {@code other}
 * @param created upload time
 * @param failureReason reason the document was rejected, once reviewed
 */
public record Document(@JsonProperty("_links") @Nullable Map<String, Link> links,
                       String id,
                       @Nullable String status,
                       @Nullable String type,
                       @Nullable Instant created,
                       @Nullable String failureReason) implements HalResource {
}
