package in.epicast.service.metadata;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Registry built from the CSV fixtures under {@code metadata/}.
 *
 * <pre>
 * src-a     cum (cumulative base), inc, inc_7dav, cum_7dav, prop (per100k), plain
 * shared-x  sig1 (cumulative), sig1_inc          stored under "shared"
 * shared-y  sig2 (weekly)                        stored under "shared"
 * src-b     daily (non-cumulative base), daily_7dav, daily_copy
 * </pre>
 */
public final class TestRegistries {

    private TestRegistries() {}

    public static SignalRegistry fixture() {
        return SignalGraphInitializer.initializeAll(
            read("metadata/sources.csv", MetadataLoader::readSources),
            read("metadata/signals.csv", MetadataLoader::readSignals));
    }

    private static <T> List<T> read(String resource, BiFunction<Reader, String, List<T>> parser) {
        InputStream in = TestRegistries.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("missing test resource " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parser.apply(reader, resource);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
