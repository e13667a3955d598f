package io.dwolla.model;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A webhook subscription of the application.
 */
public record WebhookSubscription(@JsonProperty("_links") @Nullable Map<String, Link> links,
                                  String id,
                                  @Nullable String url,
                                  boolean paused,
                                  @Nullable Instant created) implements HalResource {
}
