package atrium.core.model.common;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Case-insensitive, immutable view of request headers.
 */
public final class RequestHeaders {

    private static final RequestHeaders EMPTY = new RequestHeaders(Map.of());

    private final Map<String, List<String>> headers;

    private RequestHeaders(Map<String, List<String>> source) {
        final var copy = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        source.forEach((name, values) -> copy.merge(name, List.copyOf(values), (a, b) -> {
            final var merged = new java.util.ArrayList<>(a);
            merged.addAll(b);
            return List.copyOf(merged);
        }));
        this.headers = Collections.unmodifiableMap(copy);
    }

    public static RequestHeaders of(Map<String, List<String>> headers) {
        return headers == null || headers.isEmpty() ? EMPTY : new RequestHeaders(headers);
    }

    public static RequestHeaders single(Map<String, String> headers) {
        final var multi = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((k, v) -> multi.put(k, List.of(v)));
        return of(multi);
    }

    public static RequestHeaders empty() {
        return EMPTY;
    }

    /** @return the first value of the header, if present */
    public Optional<String> first(String name) {
        final var values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    /** @return the first value of the header, or null */
    public String get(String name) {
        return first(name).orElse(null);
    }

    public Map<String, List<String>> asMap() {
        return headers;
    }
}
