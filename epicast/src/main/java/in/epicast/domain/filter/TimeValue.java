package in.epicast.domain.filter;

/**
 * A single time point or an inclusive [start, end] range of time points.
 */
public record TimeValue(int start, int end) {

    public TimeValue {
        if (start > end) {
            throw new IllegalArgumentException("range start " + start + " is after end " + end);
        }
    }

    public static TimeValue point(int value) {
        return new TimeValue(value, value);
    }

    public static TimeValue range(int start, int end) {
        return new TimeValue(start, end);
    }

    public boolean isRange() {
        return start != end;
    }

    public boolean contains(int value) {
        return value >= start && value <= end;
    }

    @Override
    public String toString() {
        return isRange() ? start + "-" + end : Integer.toString(start);
    }
}
