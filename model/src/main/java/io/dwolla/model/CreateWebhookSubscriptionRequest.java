package io.dwolla.model;

import io.dwolla.util.Assert;

/**
 * Body of {@code POST /webhook-subscriptions}.
 *
 * @param url the URL webhooks are delivered to
 * @param secret shared secret used to sign webhook payloads
 */
public record CreateWebhookSubscriptionRequest(String url, String secret) {

    public CreateWebhookSubscriptionRequest {
        Assert.checkNotBlankParam("url", url);
        Assert.checkNotBlankParam("secret", secret);
    }
}
