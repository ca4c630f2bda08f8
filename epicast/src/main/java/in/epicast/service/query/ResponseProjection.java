package in.epicast.service.query;

import in.epicast.domain.data.FactRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field lists and row order of the query endpoint's response.
 *
 * The query always reads the full standard field set; the identifying columns
 * are needed for tagging and series transforms. {@link #project(FactRow)}
 * trims each output row to the selected projection.
 */
public enum ResponseProjection {

    STANDARD(
        List.of("source", "signal", "geo_type", "geo_value", "time_type"),
        List.of("time_value", "issue", "lag"),
        List.of("value", "stderr", "sample_size"),
        List.of("source", "signal", "time_type", "time_value", "geo_type", "geo_value", "issue")),

    /** Legacy row shape: no source, geo_type or time_type columns. */
    COMPATIBILITY(
        List.of("geo_value", "signal"),
        List.of("time_value", "issue", "lag"),
        List.of("value", "stderr", "sample_size"),
        List.of("signal", "time_value", "geo_value", "issue"));

    private final List<String> stringFields;
    private final List<String> intFields;
    private final List<String> floatFields;
    private final List<String> order;

    ResponseProjection(List<String> stringFields, List<String> intFields, List<String> floatFields,
                       List<String> order) {
        this.stringFields = stringFields;
        this.intFields = intFields;
        this.floatFields = floatFields;
        this.order = order;
    }

    public static ResponseProjection forMode(boolean compatibility) {
        return compatibility ? COMPATIBILITY : STANDARD;
    }

    public List<String> fields() {
        List<String> all = new ArrayList<>(stringFields);
        all.addAll(intFields);
        all.addAll(floatFields);
        return all;
    }

    public FactRow project(FactRow row) {
        if (this == STANDARD) {
            return row;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (String field : fields()) {
            out.put(field, row.get(field));
        }
        return FactRow.of(out);
    }

    /**
     * Configure the builder to read the full standard field set in this
     * projection's order.
     */
    public QueryBuilder configure(QueryBuilder builder) {
        return builder
            .setFields(STANDARD.stringFields, STANDARD.intFields, STANDARD.floatFields)
            .setOrder(order.toArray(new String[0]));
    }
}
