package in.epicast.service.derivation;

import in.epicast.domain.model.SignalKey;

/**
 * A row together with the signal it is emitted as.
 *
 * @param replayed true if the row came out of the replay phase
 */
public record TaggedRow<R>(R row, SignalKey target, boolean replayed) {
}
