package io.dwolla.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Funding sources of a customer or account.
 */
public record GetFundingSourcesResponse(@JsonProperty("_links") @Nullable Map<String, Link> links,
                                        @JsonProperty("_embedded") @Nullable Embedded embedded) implements HalResource {

    public List<FundingSource> fundingSources() {
        if (embedded == null || embedded.fundingSources() == null) {
            return List.of();
        }
        return embedded.fundingSources();
    }

    public record Embedded(@JsonProperty("funding-sources") @Nullable List<FundingSource> fundingSources) {
    }
}
