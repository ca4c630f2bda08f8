package in.epicast.domain.model;

/**
 * Change of one series between an anchor time point and a basis time point,
 * plus the position of the anchor relative to the window's minimum and maximum.
 * Values are null when the series has no row at that time point.
 */
public record Trend(
    String geoType,
    String geoValue,
    String source,
    String signal,
    int date,
    Double value,
    int basisDate,
    Double basisValue,
    Double pctChange,
    Double absChange,
    TrendDirection direction,
    Integer minDate,
    Double minValue,
    TrendDirection minTrend,
    Integer maxDate,
    Double maxValue,
    TrendDirection maxTrend
) {
    public Double anchorValue() {
        return value;
    }
}
