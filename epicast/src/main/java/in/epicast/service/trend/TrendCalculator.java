package in.epicast.service.trend;

import in.epicast.domain.data.FactRow;
import in.epicast.domain.model.Trend;
import in.epicast.domain.model.TrendDirection;

import java.util.List;

/**
 * Computes the change of one series between an anchor day and a basis day.
 *
 * Reference values are matched on the exact time point, without interpolation.
 * The change counts as increasing / decreasing once its magnitude reaches the
 * neutrality threshold (in percent of the reference value); below that it is
 * steady. A zero reference value has no percent change, and the direction
 * follows the sign of the absolute change.
 */
public final class TrendCalculator {

    private final double thresholdPct;

    public TrendCalculator(double thresholdPct) {
        if (thresholdPct < 0) {
            throw new IllegalArgumentException("threshold must be >= 0, got " + thresholdPct);
        }
        this.thresholdPct = thresholdPct;
    }

    /**
     * @param series rows of a single (geo_type, geo_value, source, signal) group, time ordered
     */
    public Trend compute(String geoType, String geoValue, String source, String signal,
                         List<FactRow> series, int anchor, int basis) {
        Double anchorValue = null;
        Double basisValue = null;
        Integer minDate = null;
        Double minValue = null;
        Integer maxDate = null;
        Double maxValue = null;

        for (FactRow row : series) {
            Integer time = row.getInteger(FactRow.TIME_VALUE);
            Double value = row.getDouble(FactRow.VALUE);
            if (time == null || value == null) {
                continue;
            }
            if (time == anchor) {
                anchorValue = value;
            }
            if (time == basis) {
                basisValue = value;
            }
            if (minValue == null || value < minValue) {
                minValue = value;
                minDate = time;
            }
            if (maxValue == null || value > maxValue) {
                maxValue = value;
                maxDate = time;
            }
        }

        Double absChange = anchorValue != null && basisValue != null ? anchorValue - basisValue : null;
        return new Trend(geoType, geoValue, source, signal,
            anchor, anchorValue, basis, basisValue,
            pctChange(anchorValue, basisValue), absChange, direction(anchorValue, basisValue),
            minDate, minValue, direction(anchorValue, minValue),
            maxDate, maxValue, direction(anchorValue, maxValue));
    }

    /**
     * Percent change from {@code reference} to {@code current}, or null when
     * undefined (missing value or zero reference).
     */
    public static Double pctChange(Double current, Double reference) {
        if (current == null || reference == null || reference == 0.0) {
            return null;
        }
        return (current - reference) * 100.0 / Math.abs(reference);
    }

    public TrendDirection direction(Double current, Double reference) {
        if (current == null || reference == null) {
            return TrendDirection.UNKNOWN;
        }
        double change = current - reference;
        Double pct = pctChange(current, reference);
        if (pct == null) {
            if (change > 0) return TrendDirection.INCREASING;
            if (change < 0) return TrendDirection.DECREASING;
            return TrendDirection.STEADY;
        }
        if (pct >= thresholdPct && change > 0) {
            return TrendDirection.INCREASING;
        }
        if (pct <= -thresholdPct && change < 0) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STEADY;
    }
}
