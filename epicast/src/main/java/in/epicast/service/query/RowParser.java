package in.epicast.service.query;

import in.epicast.domain.data.FactRow;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Casts raw storage values to the projection's declared types: string,
 * integer or float fields. Nulls stay null.
 */
public record RowParser(List<String> stringFields, List<String> intFields, List<String> floatFields) {

    public RowParser {
        stringFields = List.copyOf(stringFields);
        intFields = List.copyOf(intFields);
        floatFields = List.copyOf(floatFields);
    }

    public FactRow parse(Map<String, Object> raw) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String f : stringFields) {
            Object v = raw.get(f);
            row.put(f, v == null ? null : v.toString());
        }
        for (String f : intFields) {
            row.put(f, toInteger(f, raw.get(f)));
        }
        for (String f : floatFields) {
            row.put(f, toDouble(f, raw.get(f)));
        }
        return FactRow.of(row);
    }

    private static Integer toInteger(String field, Object v) {
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        try {
            return new BigDecimal(v.toString().trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("field " + field + " is not an integer: " + v, e);
        }
    }

    private static Double toDouble(String field, Object v) {
        if (v == null) return null;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.valueOf(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("field " + field + " is not a number: " + v, e);
        }
    }
}
