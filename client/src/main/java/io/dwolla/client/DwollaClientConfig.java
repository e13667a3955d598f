package io.dwolla.client;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import io.dwolla.client.http.RestClientBuilder;
import io.dwolla.client.http.RestClientOptions;
import io.dwolla.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Configuration of a {@link DwollaClient} and its {@link TokenManager}.
 * <p>
 * Instances are immutable; use {@link #builder()} or {@link #fromEnvironment(Map)}.
 * The API URL defaults to the environment's URL and the token URL to {@code <api url>/token}.
 */
public class DwollaClientConfig {

    public static final String APP_KEY_VARIABLE = "DWOLLA_APP_KEY";
    public static final String APP_SECRET_VARIABLE = "DWOLLA_APP_SECRET";
    public static final String ENVIRONMENT_VARIABLE = "DWOLLA_ENVIRONMENT";
    public static final String API_URL_VARIABLE = "DWOLLA_API_URL";

    private final DwollaEnvironment environment;
    private final URI apiUrl;
    private final URI tokenUrl;
    private final String userAgent;
    private final Duration connectTimeout;
    private final @Nullable Duration requestTimeout;
    private final RestClientBuilder restClientBuilder;
    private final @Nullable String appKey;
    private final @Nullable String appSecret;

    private DwollaClientConfig(Builder builder) {
        this.environment = builder.environment;
        this.apiUrl = builder.apiUrl != null ? builder.apiUrl : environment.getApiUrl();
        this.tokenUrl = builder.tokenUrl != null ? builder.tokenUrl : DwollaEnvironment.tokenUrlFor(apiUrl);
        this.userAgent = builder.userAgent;
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.restClientBuilder = builder.restClientBuilder;
        this.appKey = builder.appKey;
        this.appSecret = builder.appSecret;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from environment variables, typically {@link System#getenv()}.
     *
     * @throws IllegalArgumentException if the application key or secret is missing, or the
     *                                  environment name is unknown
     */
    public static DwollaClientConfig fromEnvironment(Map<String, String> variables) {
        Assert.checkNotNullParam("variables", variables);
        Builder builder = builder()
                .appKey(required(variables, APP_KEY_VARIABLE))
                .appSecret(required(variables, APP_SECRET_VARIABLE));

        String environment = variables.get(ENVIRONMENT_VARIABLE);
        if (environment != null && !environment.isBlank()) {
            builder.environment(DwollaEnvironment.fromName(environment));
        }
        String apiUrl = variables.get(API_URL_VARIABLE);
        if (apiUrl != null && !apiUrl.isBlank()) {
            builder.apiUrl(URI.create(DwollaEnvironment.stripTrailingSlash(apiUrl.trim())));
        }
        return builder.build();
    }

    private static String required(Map<String, String> variables, String name) {
        String value = variables.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required environment variable " + name);
        }
        return value;
    }

    public DwollaEnvironment getEnvironment() {
        return environment;
    }

    public URI getApiUrl() {
        return apiUrl;
    }

    public URI getTokenUrl() {
        return tokenUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public @Nullable Duration getRequestTimeout() {
        return requestTimeout;
    }

    public RestClientBuilder getRestClientBuilder() {
        return restClientBuilder;
    }

    public @Nullable String getAppKey() {
        return appKey;
    }

    public @Nullable String getAppSecret() {
        return appSecret;
    }

    @Override
    public String toString() {
        return "DwollaClientConfig{environment=" + environment + ", apiUrl=" + apiUrl + ", tokenUrl=" + tokenUrl
                + ", userAgent=" + userAgent + ", appKey=" + appKey + "}";
    }

    public static class Builder {
        private DwollaEnvironment environment = DwollaEnvironment.SANDBOX;
        private @Nullable URI apiUrl;
        private @Nullable URI tokenUrl;
        private String userAgent = DwollaClient.USER_AGENT;
        private Duration connectTimeout = RestClientOptions.DEFAULT_CONNECT_TIMEOUT;
        private @Nullable Duration requestTimeout = RestClientOptions.DEFAULT_REQUEST_TIMEOUT;
        private RestClientBuilder restClientBuilder = RestClientBuilder.DEFAULT_FACTORY;
        private @Nullable String appKey;
        private @Nullable String appSecret;

        private Builder() {
        }

        public Builder environment(DwollaEnvironment environment) {
            this.environment = Assert.checkNotNullParam("environment", environment);
            return this;
        }

        /**
         * Overrides the environment's API URL, e.g. to point at a local stub.
         */
        public Builder apiUrl(URI apiUrl) {
            this.apiUrl = Assert.checkNotNullParam("apiUrl", apiUrl);
            return this;
        }

        public Builder tokenUrl(URI tokenUrl) {
            this.tokenUrl = Assert.checkNotNullParam("tokenUrl", tokenUrl);
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = Assert.checkNotBlankParam("userAgent", userAgent);
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Assert.checkNotNullParam("connectTimeout", connectTimeout);
            return this;
        }

        public Builder requestTimeout(@Nullable Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder restClientBuilder(RestClientBuilder restClientBuilder) {
            this.restClientBuilder = Assert.checkNotNullParam("restClientBuilder", restClientBuilder);
            return this;
        }

        public Builder appKey(String appKey) {
            this.appKey = Assert.checkNotBlankParam("appKey", appKey);
            return this;
        }

        public Builder appSecret(String appSecret) {
            this.appSecret = Assert.checkNotBlankParam("appSecret", appSecret);
            return this;
        }

        public DwollaClientConfig build() {
            return new DwollaClientConfig(this);
        }
    }
}
