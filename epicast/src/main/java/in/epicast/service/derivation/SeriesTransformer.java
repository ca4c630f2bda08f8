package in.epicast.service.derivation;

import in.epicast.domain.data.FactRow;
import in.epicast.domain.filter.TimeType;
import in.epicast.domain.model.TransformKind;
import in.epicast.util.TimeValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Materializes derived series from base rows.
 *
 * Rows are grouped into series by (geo_type, geo_value, time_type). When a
 * series has several issues for one time point, the greatest issue is used.
 * Output rows keep the relative order of the input rows they were computed at.
 * A point is emitted only if every predecessor it needs is present.
 */
public final class SeriesTransformer {
    private static final Logger log = LoggerFactory.getLogger(SeriesTransformer.class);

    private final int window;

    public SeriesTransformer(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("smoothing window must be >= 1, got " + window);
        }
        this.window = window;
    }

    /**
     * Number of time steps before the first requested point that the transform
     * reads, so a query can fetch enough base rows for the first output row.
     */
    public int lookback(TransformKind kind) {
        return switch (kind) {
            case IDENTITY -> 0;
            case DIFF -> 1;
            case SMOOTH -> window - 1;
            case DIFF_THEN_SMOOTH -> window;
        };
    }

    public List<FactRow> apply(TransformKind kind, List<FactRow> rows) {
        return switch (kind) {
            case IDENTITY -> rows;
            case DIFF -> diff(rows);
            case SMOOTH -> smooth(rows);
            case DIFF_THEN_SMOOTH -> smooth(diff(rows));
        };
    }

    /**
     * value(t) - value(t-1) for consecutive time points.
     */
    public List<FactRow> diff(List<FactRow> rows) {
        SeriesIndex index = new SeriesIndex(rows);
        List<FactRow> out = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (!index.isChosen(i)) {
                continue;
            }
            FactRow row = rows.get(i);
            Double current = row.getDouble(FactRow.VALUE);
            Double previous = index.valueAt(row, -1);
            if (current != null && previous != null) {
                out.add(row.withDerivedValue(current - previous));
            }
        }
        return out;
    }

    /**
     * Trailing mean over {@code window} consecutive time points.
     */
    public List<FactRow> smooth(List<FactRow> rows) {
        SeriesIndex index = new SeriesIndex(rows);
        List<FactRow> out = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (!index.isChosen(i)) {
                continue;
            }
            FactRow row = rows.get(i);
            Double current = row.getDouble(FactRow.VALUE);
            if (current == null) {
                continue;
            }
            double sum = current;
            boolean complete = true;
            for (int step = 1; step < window; step++) {
                Double v = index.valueAt(row, -step);
                if (v == null) {
                    complete = false;
                    break;
                }
                sum += v;
            }
            if (complete) {
                out.add(row.withDerivedValue(sum / window));
            }
        }
        return out;
    }

    private record SeriesKey(Object geoType, Object geoValue, TimeType timeType) {
        static SeriesKey of(FactRow row) {
            TimeType type = TimeType.fromCode(row.getString(FactRow.TIME_TYPE));
            return new SeriesKey(row.get(FactRow.GEO_TYPE), row.get(FactRow.GEO_VALUE),
                type == null ? TimeType.DAY : type);
        }
    }

    /**
     * (series, time) -> position of the row with the greatest issue.
     */
    private static final class SeriesIndex {
        private final List<FactRow> rows;
        private final Map<SeriesKey, Map<Integer, Integer>> positions = new HashMap<>();

        SeriesIndex(List<FactRow> rows) {
            this.rows = rows;
            for (int i = 0; i < rows.size(); i++) {
                FactRow row = rows.get(i);
                Integer time = row.getInteger(FactRow.TIME_VALUE);
                if (time == null) {
                    continue;
                }
                Map<Integer, Integer> series = positions.computeIfAbsent(SeriesKey.of(row), k -> new HashMap<>());
                Integer existing = series.get(time);
                if (existing == null || issueOf(rows.get(existing)) < issueOf(row)) {
                    series.put(time, i);
                }
            }
        }

        boolean isChosen(int i) {
            FactRow row = rows.get(i);
            Integer time = row.getInteger(FactRow.TIME_VALUE);
            if (time == null) {
                return false;
            }
            Integer chosen = positions.get(SeriesKey.of(row)).get(time);
            return chosen != null && chosen == i;
        }

        Double valueAt(FactRow row, int steps) {
            SeriesKey key = SeriesKey.of(row);
            int time;
            try {
                time = TimeValues.shift(key.timeType(), row.getInteger(FactRow.TIME_VALUE), steps);
            } catch (DateTimeException | IllegalArgumentException e) {
                log.debug("Invalid time value in series {}: {}", key, e.getMessage());
                return null;
            }
            Integer pos = positions.get(key).get(time);
            return pos == null ? null : rows.get(pos).getDouble(FactRow.VALUE);
        }

        private static long issueOf(FactRow row) {
            Integer issue = row.getInteger(FactRow.ISSUE);
            return issue == null ? Long.MIN_VALUE : issue;
        }
    }
}
