package io.dwolla.model;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dwolla.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /transfers}. Source and destination are given as {@code _links}.
 */
public record CreateTransferRequest(@JsonProperty("_links") Map<String, Link> links,
                                    Money amount,
                                    @Nullable String correlationId) {

    public static final String SOURCE = "source";
    public static final String DESTINATION = "destination";

    public CreateTransferRequest {
        Assert.checkNotNullParam("links", links);
        Assert.checkNotNullParam("amount", amount);
        if (!links.containsKey(SOURCE) || !links.containsKey(DESTINATION)) {
            throw new IllegalArgumentException("A transfer requires both a source and a destination link");
        }
    }

    public static CreateTransferRequest of(URI source, URI destination, Money amount) {
        return of(source, destination, amount, null);
    }

    public static CreateTransferRequest of(URI source, URI destination, Money amount, @Nullable String correlationId) {
        Map<String, Link> links = new LinkedHashMap<>();
        links.put(SOURCE, Link.of(Assert.checkNotNullParam("source", source)));
        links.put(DESTINATION, Link.of(Assert.checkNotNullParam("destination", destination)));
        return new CreateTransferRequest(links, amount, correlationId);
    }
}
