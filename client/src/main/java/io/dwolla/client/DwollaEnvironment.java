package io.dwolla.client;

import java.net.URI;
import java.util.Locale;

/**
 * The Dwolla deployments an application can talk to.
 */
public enum DwollaEnvironment {

    SANDBOX("https://api-sandbox.dwolla.com"),
    PRODUCTION("https://api.dwolla.com");

    private final URI apiUrl;

    DwollaEnvironment(String apiUrl) {
        this.apiUrl = URI.create(apiUrl);
    }

    public URI getApiUrl() {
        return apiUrl;
    }

    public URI getTokenUrl() {
        return tokenUrlFor(apiUrl);
    }

    static URI tokenUrlFor(URI apiUrl) {
        return URI.create(stripTrailingSlash(apiUrl.toString()) + "/token");
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * @param name {@code sandbox} or {@code production}, case-insensitive
     * @throws IllegalArgumentException for any other name
     */
    public static DwollaEnvironment fromName(String name) {
        for (DwollaEnvironment environment : values()) {
            if (environment.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                return environment;
            }
        }
        throw new IllegalArgumentException("Unknown Dwolla environment: " + name);
    }
}
