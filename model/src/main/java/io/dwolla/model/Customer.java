package io.dwolla.model;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A customer of the application.
 *
 * @param links related resources, e.g. {@code funding-sources} and {@code transfers}
 * @param id the customer id
 * @param firstName first name
 * @param lastName last name
 * @param email email address
 * @param type {@code unverified}, {@code personal}, {@code business} or {@code receive-only}
 * @param status lifecycle status, e.g. {@code unverified}, {@code verified} or {@code suspended}
 * @param businessName business name, for business and unverified customers that supplied one
 * @param created creation time
 */
public record Customer(@JsonProperty("_links") @Nullable Map<String, Link> links,
                       String id,
                       @Nullable String firstName,
                       @Nullable String lastName,
                       @Nullable String email,
                       @Nullable String type,
                       @Nullable String status,
                       @Nullable String businessName,
                       @Nullable Instant created) implements HalResource {
}
