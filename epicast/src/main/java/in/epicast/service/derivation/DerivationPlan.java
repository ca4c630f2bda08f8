package in.epicast.service.derivation;

import in.epicast.domain.filter.SourceSignalPair;

import java.util.List;

/**
 * Pairs rewritten down to stored base signals, and how to replay the base rows.
 */
public record DerivationPlan(List<SourceSignalPair> basePairs, ReplayTable replayTable) {

    public DerivationPlan {
        basePairs = List.copyOf(basePairs);
    }
}
