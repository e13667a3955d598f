package io.dwolla.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Error body returned by the API for failed requests.
 * <p>
 * Validation failures additionally carry one {@link ErrorDetail} per offending field under
 * {@code _embedded.errors}.
 *
 * @param code machine readable error code, e.g. {@code ExpiredAccessToken}
 * @param message human readable description
 * @param embedded nested validation errors, if any
 */
public record ErrorResponse(@Nullable String code, @Nullable String message,
                            @JsonProperty("_embedded") @Nullable Embedded embedded) {

    /**
     * @return the nested validation errors, empty when there are none
     */
    public List<ErrorDetail> errors() {
        if (embedded == null || embedded.errors() == null) {
            return List.of();
        }
        return embedded.errors();
    }

    public record Embedded(@Nullable List<ErrorDetail> errors) {
    }

    /**
     * @param code the validation error code, e.g. {@code Required}
     * @param message human readable description
     * @param path JSON pointer to the offending request field, e.g. {@code /email}
     * @param links related resources
     */
    public record ErrorDetail(@Nullable String code, @Nullable String message, @Nullable String path,
                              @JsonProperty("_links") @Nullable Map<String, Link> links) {
    }
}
