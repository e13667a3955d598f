package io.dwolla.model;

import java.net.URI;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A HAL link relation target.
 *
 * @param href the absolute URL of the linked resource
 * @param type the media type of the linked resource, if advertised
 * @param resourceType the kind of resource the link points at, e.g. {@code customer}
 */
public record Link(String href, @Nullable String type, @JsonProperty("resource-type") @Nullable String resourceType) {

    public static Link of(String href) {
        return new Link(href, null, null);
    }

    public static Link of(URI href) {
        return of(href.toString());
    }

    public URI toUri() {
        return URI.create(href);
    }
}
