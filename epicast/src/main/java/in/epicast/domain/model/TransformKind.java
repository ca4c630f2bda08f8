package in.epicast.domain.model;

/**
 * Post-processing needed to materialize a derived signal from its base rows.
 */
public enum TransformKind {
    IDENTITY,
    DIFF,
    SMOOTH,
    /** Difference first, then smooth the differenced series. */
    DIFF_THEN_SMOOTH
}
