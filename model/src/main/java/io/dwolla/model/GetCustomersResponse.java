package io.dwolla.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A page of customers from {@code GET /customers}.
 */
public record GetCustomersResponse(@JsonProperty("_links") @Nullable Map<String, Link> links,
                                   @JsonProperty("_embedded") @Nullable Embedded embedded,
                                   int total) implements HalResource {

    public List<Customer> customers() {
        if (embedded == null || embedded.customers() == null) {
            return List.of();
        }
        return embedded.customers();
    }

    public record Embedded(@Nullable List<Customer> customers) {
    }
}
