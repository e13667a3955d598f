package io.dwolla.client;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.dwolla.client.http.RestResponse;
import io.dwolla.model.AppTokenRequest;
import io.dwolla.model.Headers;
import io.dwolla.model.TokenResponse;
import io.dwolla.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains application access tokens with the OAuth2 client credentials grant and reuses each
 * token until it is about to expire.
 * <p>
 * A token is considered expired {@code expirySkew} before the {@code expires_in} the token
 * endpoint announced, so requests in flight do not race the expiry. Safe for use from several
 * threads; at most one token request is made at a time.
 */
public class TokenManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenManager.class);

    public static final Duration DEFAULT_EXPIRY_SKEW = Duration.ofSeconds(60);

    private final DwollaClient client;
    private final URI tokenUrl;
    private final AppTokenRequest credentials;
    private final Clock clock;
    private final Duration expirySkew;

    private @Nullable String token;
    private Instant expiresAt = Instant.MIN;

    public TokenManager(DwollaClient client, URI tokenUrl, String appKey, String appSecret,
                        Clock clock, Duration expirySkew) {
        this.client = Assert.checkNotNullParam("client", client);
        this.tokenUrl = Assert.checkNotNullParam("tokenUrl", tokenUrl);
        this.credentials = AppTokenRequest.clientCredentials(appKey, appSecret);
        this.clock = Assert.checkNotNullParam("clock", clock);
        this.expirySkew = Assert.checkNotNullParam("expirySkew", expirySkew);
    }

    /**
     * @throws IllegalArgumentException if the configuration has no application key or secret
     */
    public static TokenManager create(DwollaClient client, DwollaClientConfig config) {
        Assert.checkNotNullParam("config", config);
        return new TokenManager(client, config.getTokenUrl(),
                Assert.checkNotBlankParam("appKey", config.getAppKey()),
                Assert.checkNotBlankParam("appSecret", config.getAppSecret()),
                Clock.systemUTC(), DEFAULT_EXPIRY_SKEW);
    }

    /**
     * @return a valid access token, fetching a new one if none is held or the held one expired
     * @throws DwollaException if the token endpoint rejects the request
     */
    public synchronized String getToken() throws DwollaException {
        Instant now = clock.instant();
        if (token != null && now.isBefore(expiresAt)) {
            return token;
        }

        RestResponse<TokenResponse> response = client.postAuth(tokenUrl, credentials, TokenResponse.class);
        TokenResponse tokenResponse = response.content();
        if (tokenResponse == null || tokenResponse.accessToken() == null) {
            throw new DwollaException("Token response did not contain an access token", response, null);
        }

        int expiresIn = tokenResponse.expiresIn() == null ? 0 : tokenResponse.expiresIn();
        token = tokenResponse.accessToken();
        expiresAt = now.plusSeconds(expiresIn).minus(expirySkew);
        LOGGER.debug("Fetched access token from {}, valid for {}s", tokenUrl, expiresIn);
        return token;
    }

    /**
     * @return {@code Authorization: Bearer <token>} for the current token
     * @throws DwollaException if a new token is needed and cannot be fetched
     */
    public Headers authorizationHeaders() throws DwollaException {
        return Headers.of("Authorization", "Bearer " + getToken());
    }

    /**
     * Drops the held token, e.g. after the API rejected it with {@code ExpiredAccessToken}.
     */
    public synchronized void invalidate() {
        token = null;
        expiresAt = Instant.MIN;
    }
}
