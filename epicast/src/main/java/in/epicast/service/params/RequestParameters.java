package in.epicast.service.params;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-valued request parameters as handed over by the transport layer.
 */
public final class RequestParameters {

    private final Map<String, List<String>> values;

    public RequestParameters(Map<String, List<String>> values) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.values = Collections.unmodifiableMap(copy);
    }

    public static RequestParameters of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected key/value pairs");
        }
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.computeIfAbsent(keyValues[i], k -> new ArrayList<>()).add(keyValues[i + 1]);
        }
        return new RequestParameters(map);
    }

    /**
     * First value of the parameter, or null when absent.
     */
    public String get(String name) {
        List<String> v = values.get(name);
        return v == null || v.isEmpty() ? null : v.get(0);
    }

    public List<String> getAll(String name) {
        return values.getOrDefault(name, List.of());
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * Whether the parameter is present with at least one non-blank value.
     */
    public boolean hasValue(String name) {
        for (String v : getAll(name)) {
            if (v != null && !v.isBlank()) {
                return true;
            }
        }
        return false;
    }
}
