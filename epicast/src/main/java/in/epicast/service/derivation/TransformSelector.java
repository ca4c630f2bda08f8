package in.epicast.service.derivation;

import in.epicast.domain.model.DataSignal;
import in.epicast.domain.model.SignalKey;
import in.epicast.domain.model.TransformKind;
import in.epicast.service.metadata.SignalRegistry;

/**
 * Chooses the transform that turns base rows into rows of a target signal.
 *
 * <pre>
 * format not raw/raw_count/count          -> IDENTITY
 * cumulative, smoothed                     -> SMOOTH
 * not cumulative, not smoothed             -> DIFF if base cumulative, else IDENTITY
 * not cumulative, smoothed                 -> DIFF_THEN_SMOOTH if base cumulative, else SMOOTH
 * cumulative, not smoothed                 -> IDENTITY
 * </pre>
 */
public final class TransformSelector {

    private final SignalRegistry registry;

    public TransformSelector(SignalRegistry registry) {
        this.registry = registry;
    }

    /**
     * Unregistered keys map to IDENTITY.
     */
    public TransformKind select(SignalKey key) {
        return registry.resolveSignal(key).map(this::select).orElse(TransformKind.IDENTITY);
    }

    public TransformKind select(DataSignal signal) {
        DataSignal base = registry.findSignal(signal.baseKey()).orElse(signal);
        return select(signal, base);
    }

    public static TransformKind select(DataSignal signal, DataSignal base) {
        if (signal.format() == null || !signal.format().isRawKind()) {
            return TransformKind.IDENTITY;
        }
        boolean baseCumulative = base != null && base.isCumulative();
        if (signal.isCumulative() && signal.isSmoothed()) {
            return TransformKind.SMOOTH;
        }
        if (!signal.isCumulative() && !signal.isSmoothed()) {
            return baseCumulative ? TransformKind.DIFF : TransformKind.IDENTITY;
        }
        if (!signal.isCumulative() && signal.isSmoothed()) {
            return baseCumulative ? TransformKind.DIFF_THEN_SMOOTH : TransformKind.SMOOTH;
        }
        return TransformKind.IDENTITY;
    }
}
