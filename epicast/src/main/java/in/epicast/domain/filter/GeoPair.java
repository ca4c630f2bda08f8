package in.epicast.domain.filter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Geography filter: a geo type with an explicit value set, or every value of
 * that type.
 */
public record GeoPair(String geoType, boolean allValues, List<String> geoValues) {

    public GeoPair {
        Objects.requireNonNull(geoType, "geoType");
        geoValues = allValues ? List.of() : List.copyOf(new LinkedHashSet<>(geoValues));
    }

    public static GeoPair of(String geoType, List<String> geoValues) {
        return new GeoPair(geoType, false, geoValues);
    }

    public static GeoPair all(String geoType) {
        return new GeoPair(geoType, true, List.of());
    }

    @Override
    public String toString() {
        return geoType + ":" + (allValues ? "*" : String.join(",", geoValues));
    }
}
