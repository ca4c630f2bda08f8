package in.epicast.domain.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of the versioned fact table, restricted to the projected fields.
 * Immutable; the {@code with} methods return modified copies.
 */
public final class FactRow {

    public static final String SOURCE = "source";
    public static final String SIGNAL = "signal";
    public static final String GEO_TYPE = "geo_type";
    public static final String GEO_VALUE = "geo_value";
    public static final String TIME_TYPE = "time_type";
    public static final String TIME_VALUE = "time_value";
    public static final String ISSUE = "issue";
    public static final String LAG = "lag";
    public static final String VALUE = "value";
    public static final String STDERR = "stderr";
    public static final String SAMPLE_SIZE = "sample_size";

    private final Map<String, Object> fields;

    private FactRow(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static FactRow of(Map<String, ?> fields) {
        return new FactRow(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public String getString(String field) {
        Object v = fields.get(field);
        return v == null ? null : v.toString();
    }

    public Integer getInteger(String field) {
        Object v = fields.get(field);
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        return Integer.valueOf(v.toString().trim());
    }

    public Double getDouble(String field) {
        Object v = fields.get(field);
        if (v == null) return null;
        if (v instanceof Number n) return n.doubleValue();
        return Double.valueOf(v.toString().trim());
    }

    public String source() {
        return getString(SOURCE);
    }

    public String signal() {
        return getString(SIGNAL);
    }

    public FactRow with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new FactRow(copy);
    }

    /**
     * Copy with value replaced and the statistics that no longer apply cleared.
     */
    public FactRow withDerivedValue(double value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(VALUE, value);
        if (copy.containsKey(STDERR)) copy.put(STDERR, null);
        if (copy.containsKey(SAMPLE_SIZE)) copy.put(SAMPLE_SIZE, null);
        return new FactRow(copy);
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FactRow other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "FactRow" + fields;
    }
}
