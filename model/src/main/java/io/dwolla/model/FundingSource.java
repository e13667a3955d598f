package io.dwolla.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A bank account or balance that money can be moved from or to.
 *
 * @param links related resources, e.g. {@code customer} and {@code transfers}
 * @param id the funding source id
 * @param status {@code unverified} or {@code verified}
 * @param type {@code bank} or {@code balance}
 * @param bankAccountType {@code checking} or {@code savings}, for bank funding sources
 * @param name nickname given when the funding source was created
 * @param created creation time
 * @param removed whether the funding source has been removed
 * @param channels the transfer channels the funding source supports, e.g. {@code ach}
 * @param bankName the financial institution name, for bank funding sources
 */
public record FundingSource(@JsonProperty("_links") @Nullable Map<String, Link> links,
                            String id,
                            @Nullable String status,
                            @Nullable String type,
                            @Nullable String bankAccountType,
                            @Nullable String name,
                            @Nullable Instant created,
                            boolean removed,
                            @Nullable List<String> channels,
                            @Nullable String bankName) implements HalResource {
}
