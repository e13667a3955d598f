package io.dwolla.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.dwolla.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Ordered set of HTTP headers to merge into an outgoing request.
 * <p>
 * Insertion order is preserved. Adding a name that is already present replaces its value
 * without moving it.
 *
 * <pre>{@code
 * Headers headers = Headers.of("Authorization", "Bearer " + token)
 *         .add("Idempotency-Key", UUID.randomUUID().toString());
 * }</pre>
 */
public final class Headers implements Iterable<Map.Entry<String, String>> {

    private final Map<String, String> values = new LinkedHashMap<>();

    public Headers() {
    }

    public Headers(Map<String, String> headers) {
        addAll(headers);
    }

    public static Headers empty() {
        return new Headers();
    }

    public static Headers of(String name, String value) {
        return new Headers().add(name, value);
    }

    public Headers add(String name, String value) {
        Assert.checkNotNullParam("name", name);
        Assert.checkNotNullParam("value", value);
        values.put(name, value);
        return this;
    }

    public Headers addAll(@Nullable Map<String, String> headers) {
        if (headers != null) {
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                add(entry.getKey(), entry.getValue());
            }
        }
        return this;
    }

    public Headers addAll(@Nullable Headers headers) {
        return headers == null ? this : addAll(headers.values);
    }

    public @Nullable String get(String name) {
        return values.get(name);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /**
     * @return an unmodifiable, insertion-ordered view of the headers
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public Iterator<Map.Entry<String, String>> iterator() {
        return asMap().entrySet().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Headers) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Headers" + values;
    }
}
