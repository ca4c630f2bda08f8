package in.epicast.service.alias;

/**
 * Maps a storage partition id back to the public source id a row is exposed under.
 */
@FunctionalInterface
public interface SourceAliasMapper {

    String toPublicSource(String storageSource, String signal);

    SourceAliasMapper IDENTITY = (storageSource, signal) -> storageSource;
}
