package io.dwolla.model;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A transfer of money between two funding sources.
 *
 * @param links related resources, e.g. {@code source}, {@code destination} and {@code cancel}
 * @param id the transfer id
 * @param status {@code pending}, {@code processed}, {@code cancelled} or {@code failed}
 * @param amount the amount moved
 * @param created creation time
 * @param correlationId caller reference supplied when the transfer was created
 */
public record Transfer(@JsonProperty("_links") @Nullable Map<String, Link> links,
                       String id,
                       @Nullable String status,
                       @Nullable Money amount,
                       @Nullable Instant created,
                       @Nullable String correlationId) implements HalResource {
}
