package in.epicast.service.alias;

import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.service.metadata.SignalRegistry;
import in.epicast.service.metadata.TestRegistries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for public/storage source id mapping.
 */
class SourceAliasResolverTest {

    private SourceAliasResolver resolver;

    @BeforeEach
    void setUp() {
        SignalRegistry registry = TestRegistries.fixture();
        resolver = new SourceAliasResolver(registry);
    }

    @Test
    void testNoAliasReturnsPairsUnchanged() {
        List<SourceSignalPair> pairs = List.of(SourceSignalPair.of("src-a", "cum"), SourceSignalPair.all("src-b"));

        AliasResolution result = resolver.resolve(pairs);

        assertEquals(pairs, result.pairs());
        assertFalse(result.usesAlias());
        assertEquals("src-a", result.mapperOrIdentity().toPublicSource("src-a", "cum"));
    }

    @Test
    void testWildcardOnAliasedSourceExpandsToDeclaredSignals() {
        AliasResolution result = resolver.resolve(List.of(SourceSignalPair.all("shared-x")));

        assertEquals(List.of(SourceSignalPair.of("shared", "sig1", "sig1_inc")), result.pairs());
        assertTrue(result.usesAlias());
    }

    @Test
    void testExplicitPairIsRewrittenToStorageId() {
        AliasResolution result = resolver.resolve(List.of(
            SourceSignalPair.of("src-a", "cum"),
            SourceSignalPair.of("shared-y", "sig2")));

        assertEquals(List.of(SourceSignalPair.of("src-a", "cum"), SourceSignalPair.of("shared", "sig2")),
            result.pairs());
    }

    @Test
    void testSingleAliasMapsBackDirectly() {
        AliasResolution result = resolver.resolve(List.of(SourceSignalPair.of("shared-y", "sig2")));

        SourceAliasMapper mapper = result.reverseMapper().orElseThrow();
        assertEquals("shared-y", mapper.toPublicSource("shared", "sig2"));
        assertEquals("shared-y", mapper.toPublicSource("shared", "sig1"));
        assertEquals("src-a", mapper.toPublicSource("src-a", "cum"));
    }

    @Test
    void testSharedStorageDisambiguatesBySignal() {
        AliasResolution result = resolver.resolve(List.of(
            SourceSignalPair.of("shared-y", "sig2"),
            SourceSignalPair.of("shared-x", "sig1")));

        SourceAliasMapper mapper = result.reverseMapper().orElseThrow();
        assertEquals("shared-x", mapper.toPublicSource("shared", "sig1"));
        assertEquals("shared-y", mapper.toPublicSource("shared", "sig2"));
        // Undeclared signal falls back to the first alias in declaration order.
        assertEquals("shared-x", mapper.toPublicSource("shared", "other"));
    }
}
