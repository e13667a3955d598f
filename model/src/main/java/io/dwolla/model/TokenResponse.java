package io.dwolla.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * OAuth2 token endpoint response.
 *
 * @param accessToken the bearer token
 * @param tokenType the token type, {@code bearer}
 * @param expiresIn lifetime of the token in seconds
 */
public record TokenResponse(@JsonProperty("access_token") @Nullable String accessToken,
                            @JsonProperty("token_type") @Nullable String tokenType,
                            @JsonProperty("expires_in") @Nullable Integer expiresIn) {

    @Override
    public String toString() {
        return "TokenResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn + "]";
    }
}
