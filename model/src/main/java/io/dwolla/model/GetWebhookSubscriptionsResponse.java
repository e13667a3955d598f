package io.dwolla.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

public record GetWebhookSubscriptionsResponse(@JsonProperty("_links") @Nullable Map<String, Link> links,
                                              @JsonProperty("_embedded") @Nullable Embedded embedded,
                                              int total) implements HalResource {

    public List<WebhookSubscription> webhookSubscriptions() {
        if (embedded == null || embedded.webhookSubscriptions() == null) {
            return List.of();
        }
        return embedded.webhookSubscriptions();
    }

    public record Embedded(@JsonProperty("webhook-subscriptions") @Nullable List<WebhookSubscription> webhookSubscriptions) {
    }
}
