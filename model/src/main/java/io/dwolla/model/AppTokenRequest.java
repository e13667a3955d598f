package io.dwolla.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dwolla.util.Assert;

/**
 * OAuth2 client-credentials token request.
 *
 * @param key the application key
 * @param secret the application secret
 * @param grantType always {@value #CLIENT_CREDENTIALS} for application tokens
 */
public record AppTokenRequest(@JsonProperty("client_id") String key,
                              @JsonProperty("client_secret") String secret,
                              @JsonProperty("grant_type") String grantType) {

    public static final String CLIENT_CREDENTIALS = "client_credentials";

    public AppTokenRequest {
        Assert.checkNotBlankParam("key", key);
        Assert.checkNotBlankParam("secret", secret);
        Assert.checkNotBlankParam("grantType", grantType);
    }

    public static AppTokenRequest clientCredentials(String key, String secret) {
        return new AppTokenRequest(key, secret, CLIENT_CREDENTIALS);
    }

    @Override
    public String toString() {
        return "AppTokenRequest[key=" + key + ", grantType=" + grantType + "]";
    }
}
