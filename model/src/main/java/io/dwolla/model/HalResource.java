package io.dwolla.model;

import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Common shape of every HAL+JSON representation returned by the API.
 */
public interface HalResource {

    /**
     * @return the {@code _links} of the representation, keyed by relation name
     */
    @Nullable Map<String, Link> links();

    /**
     * Looks up a single link relation.
     *
     * @param rel the relation name, e.g. {@code self} or {@code funding-sources}
     * @return the link, or {@code null} if the representation does not carry it
     */
    default @Nullable Link link(String rel) {
        Map<String, Link> links = links();
        return links == null ? null : links.get(rel);
    }

    default boolean hasLink(String rel) {
        return link(rel) != null;
    }
}
