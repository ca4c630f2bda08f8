package in.epicast.service.query;

import in.epicast.domain.filter.GeoPair;
import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.domain.filter.TimePair;
import in.epicast.domain.filter.TimeValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Accumulates projection, filters, ordering and one revision-selection clause
 * into a query with named parameters ({@code :name}) against the
 * issue-versioned fact table.
 *
 * Explicit value sets become IN / BETWEEN conditions; match-all pairs filter
 * only on their type column. Instances are per request and not thread-safe.
 */
public final class QueryBuilder {

    /** Columns identifying one observation series (all issues of one data point). */
    static final List<String> SERIES_KEY = List.of(
        "time_type", "time_value", "source", "signal", "geo_type", "geo_value");

    private final String table;
    private final String alias;

    private final List<String> stringFields = new ArrayList<>();
    private final List<String> intFields = new ArrayList<>();
    private final List<String> floatFields = new ArrayList<>();
    private final List<String> order = new ArrayList<>();
    private final List<String> conditions = new ArrayList<>();
    private final Map<String, Object> params = new LinkedHashMap<>();
    private final Map<String, Integer> paramCounters = new HashMap<>();

    private String subquery = "";
    private Integer limit;
    private RevisionSelection.Mode revisionMode;

    public QueryBuilder(String table, String alias) {
        this.table = Objects.requireNonNull(table, "table");
        this.alias = Objects.requireNonNull(alias, "alias");
    }

    public QueryBuilder setFields(List<String> strings, List<String> ints, List<String> floats) {
        stringFields.clear();
        stringFields.addAll(strings);
        intFields.clear();
        intFields.addAll(ints);
        floatFields.clear();
        floatFields.addAll(floats);
        return this;
    }

    public QueryBuilder setOrder(String... fields) {
        order.clear();
        Collections.addAll(order, fields);
        return this;
    }

    public QueryBuilder setLimit(Integer limit) {
        this.limit = limit;
        return this;
    }

    /**
     * field = value
     */
    public QueryBuilder where(String field, Object value) {
        String p = nextParam(field);
        params.put(p, value);
        conditions.add(col(field) + " = :" + p);
        return this;
    }

    /**
     * field matches any of the points / inclusive ranges.
     */
    public QueryBuilder whereIntegers(String field, List<TimeValue> values) {
        conditions.add(integerCondition(field, values, field));
        return this;
    }

    public QueryBuilder whereSourceSignalPairs(String typeField, String valueField, List<SourceSignalPair> pairs) {
        List<String> ors = new ArrayList<>();
        for (SourceSignalPair pair : pairs) {
            ors.add(pairCondition(typeField, pair.source(), valueField, pair.allSignals(), pair.signals()));
        }
        conditions.add(joinOr(ors));
        return this;
    }

    public QueryBuilder whereGeoPairs(String typeField, String valueField, List<GeoPair> pairs) {
        List<String> ors = new ArrayList<>();
        for (GeoPair pair : pairs) {
            ors.add(pairCondition(typeField, pair.geoType(), valueField, pair.allValues(), pair.geoValues()));
        }
        conditions.add(joinOr(ors));
        return this;
    }

    public QueryBuilder whereTimePairs(String typeField, String valueField, List<TimePair> pairs) {
        List<String> ors = new ArrayList<>();
        for (TimePair pair : pairs) {
            String typeParam = nextParam(typeField);
            params.put(typeParam, pair.timeType().code());
            String typeCond = col(typeField) + " = :" + typeParam;
            if (pair.allValues()) {
                ors.add(typeCond);
            } else {
                ors.add("(" + typeCond + " AND " + integerCondition(valueField, pair.timeValues(), valueField) + ")");
            }
        }
        conditions.add(joinOr(ors));
        return this;
    }

    /**
     * Add the revision-selection clause. May be applied once, after all other
     * filters, since the as-of subquery repeats the filters collected so far.
     */
    public QueryBuilder applyRevision(RevisionSelection revision) {
        if (revisionMode != null) {
            throw new IllegalStateException("revision selection already applied: " + revisionMode);
        }
        revisionMode = revision.mode();
        switch (revisionMode) {
            case ISSUES -> whereIntegers("issue", revision.issues());
            case LAG -> where("lag", revision.lag());
            case AS_OF -> applyAsOf(revision.asOf());
            case LATEST -> conditions.add(col("is_latest_issue") + " IS TRUE");
        }
        return this;
    }

    /**
     * Join each series to the greatest issue not after {@code asOf}. Series
     * without such an issue produce no row.
     */
    private void applyAsOf(int asOf) {
        params.put("as_of", asOf);
        String join = SERIES_KEY.stream()
            .map(k -> "x." + k + " = " + col(k))
            .collect(Collectors.joining(" AND "));
        subquery = "JOIN (SELECT max(" + col("issue") + ") max_issue, " + qualified(SERIES_KEY)
            + " FROM " + table + " " + alias
            + " WHERE " + conditionsClause() + " AND (" + col("issue") + " <= :as_of)"
            + " GROUP BY " + qualified(SERIES_KEY) + ") x"
            + " ON x.max_issue = " + col("issue") + " AND " + join;
    }

    public String conditionsClause() {
        if (conditions.isEmpty()) {
            return "TRUE";
        }
        return conditions.stream().map(c -> "(" + c + ")").collect(Collectors.joining(" AND "));
    }

    public Map<String, Object> params() {
        return Collections.unmodifiableMap(params);
    }

    public RevisionSelection.Mode revisionMode() {
        return revisionMode;
    }

    public RowParser rowParser() {
        return new RowParser(stringFields, intFields, floatFields);
    }

    public List<String> fields() {
        List<String> all = new ArrayList<>(stringFields);
        all.addAll(intFields);
        all.addAll(floatFields);
        return all;
    }

    public String toSql() {
        StringBuilder sql = new StringBuilder("SELECT ");
        List<String> fields = fields();
        sql.append(fields.isEmpty() ? "*" : qualified(fields));
        sql.append(" FROM ").append(table).append(' ').append(alias);
        if (!subquery.isEmpty()) {
            sql.append(' ').append(subquery);
        }
        sql.append(" WHERE ").append(conditionsClause());
        if (!order.isEmpty()) {
            sql.append(" ORDER BY ").append(order.stream().map(o -> col(o) + " ASC").collect(Collectors.joining(", ")));
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        return sql.toString();
    }

    @Override
    public String toString() {
        return toSql();
    }

    // ───────────────────────────────────────────────────────────────

    private String pairCondition(String typeField, String type, String valueField, boolean all, List<String> values) {
        String typeParam = nextParam(typeField);
        params.put(typeParam, type);
        String typeCond = col(typeField) + " = :" + typeParam;
        if (all) {
            return typeCond;
        }
        return "(" + typeCond + " AND " + inCondition(valueField, values, typeParam + "_" + valueField) + ")";
    }

    private String inCondition(String field, List<String> values, String paramPrefix) {
        if (values.isEmpty()) {
            return "FALSE";
        }
        List<String> names = new ArrayList<>(values.size());
        for (String v : values) {
            String p = nextParam(paramPrefix);
            params.put(p, v);
            names.add(":" + p);
        }
        return col(field) + " IN (" + String.join(", ", names) + ")";
    }

    private String integerCondition(String field, List<TimeValue> values, String paramPrefix) {
        if (values.isEmpty()) {
            return "FALSE";
        }
        List<String> ors = new ArrayList<>(values.size());
        for (TimeValue v : values) {
            if (v.isRange()) {
                String a = nextParam(paramPrefix);
                String b = nextParam(paramPrefix);
                params.put(a, v.start());
                params.put(b, v.end());
                ors.add(col(field) + " BETWEEN :" + a + " AND :" + b);
            } else {
                String p = nextParam(paramPrefix);
                params.put(p, v.start());
                ors.add(col(field) + " = :" + p);
            }
        }
        return ors.size() == 1 ? ors.get(0) : "(" + String.join(" OR ", ors) + ")";
    }

    private static String joinOr(List<String> ors) {
        if (ors.isEmpty()) {
            return "FALSE";
        }
        return ors.size() == 1 ? ors.get(0) : String.join(" OR ", ors);
    }

    private String nextParam(String prefix) {
        int n = paramCounters.merge(prefix, 1, Integer::sum) - 1;
        return prefix + "_" + n;
    }

    private String col(String field) {
        return alias + "." + field;
    }

    private String qualified(List<String> fields) {
        return fields.stream().map(this::col).collect(Collectors.joining(", "));
    }
}
