package in.epicast.service.query;

import in.epicast.domain.filter.TimeValue;

import java.util.List;

/**
 * Which issue of each observation to read. Exactly one mode applies, chosen by
 * priority: explicit issues, then lag, then as-of, then latest issue.
 */
public record RevisionSelection(List<TimeValue> issues, Integer lag, Integer asOf) {

    public enum Mode {
        ISSUES,
        LAG,
        AS_OF,
        LATEST
    }

    private static final RevisionSelection LATEST = new RevisionSelection(null, null, null);

    public RevisionSelection {
        issues = issues == null ? null : List.copyOf(issues);
    }

    public static RevisionSelection latest() {
        return LATEST;
    }

    public static RevisionSelection issues(List<TimeValue> issues) {
        return new RevisionSelection(issues, null, null);
    }

    public static RevisionSelection lag(int lag) {
        return new RevisionSelection(null, lag, null);
    }

    public static RevisionSelection asOf(int asOf) {
        return new RevisionSelection(null, null, asOf);
    }

    public Mode mode() {
        if (issues != null && !issues.isEmpty()) return Mode.ISSUES;
        if (lag != null) return Mode.LAG;
        if (asOf != null) return Mode.AS_OF;
        return Mode.LATEST;
    }
}
