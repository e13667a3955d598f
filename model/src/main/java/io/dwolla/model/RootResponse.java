package io.dwolla.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Response of {@code GET /}: the entry point links available to the authenticated application.
 */
public record RootResponse(@JsonProperty("_links") @Nullable Map<String, Link> links) implements HalResource {
}
