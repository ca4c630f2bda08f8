package in.epicast.service.alias;

import in.epicast.domain.filter.SourceSignalPair;

import java.util.List;
import java.util.Optional;

/**
 * Pairs rewritten to storage ids, plus the reverse mapping when any alias was used.
 */
public record AliasResolution(List<SourceSignalPair> pairs, Optional<SourceAliasMapper> reverseMapper) {

    public AliasResolution {
        pairs = List.copyOf(pairs);
    }

    public boolean usesAlias() {
        return reverseMapper.isPresent();
    }

    /**
     * Reverse mapper, or the identity mapping when no alias was involved.
     */
    public SourceAliasMapper mapperOrIdentity() {
        return reverseMapper.orElse(SourceAliasMapper.IDENTITY);
    }
}
