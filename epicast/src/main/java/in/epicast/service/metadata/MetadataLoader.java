package in.epicast.service.metadata;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import in.epicast.domain.common.MetadataLoadException;
import in.epicast.domain.filter.TimeType;
import in.epicast.domain.model.DataSignal;
import in.epicast.domain.model.DataSource;
import in.epicast.domain.model.HighValuesAre;
import in.epicast.domain.model.SignalCategory;
import in.epicast.domain.model.SignalFormat;
import in.epicast.domain.model.WebLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads the static source and signal definitions from CSV.
 *
 * Column headers are normalized (lower case, spaces and dashes to underscores)
 * before they are mapped, so "Signal BaseName" and "signal_basename" are the
 * same column. Missing optional columns default to absent; unknown columns are
 * ignored.
 */
public final class MetadataLoader {
    private static final Logger log = LoggerFactory.getLogger(MetadataLoader.class);

    public static final String DEFAULT_SOURCES_RESOURCE = "db_sources.csv";
    public static final String DEFAULT_SIGNALS_RESOURCE = "db_signals.csv";

    private static final CsvMapper CSV = new CsvMapper();
    private static final Set<String> TRUE_VALUES = Set.of("true", "t", "1", "yes", "y");

    private MetadataLoader() {}

    /**
     * Load both files and build the registry. A null path means the bundled
     * classpath resource.
     */
    public static SignalRegistry load(String sourcesPath, String signalsPath) {
        List<DataSource> sources;
        try (Reader reader = open(sourcesPath, DEFAULT_SOURCES_RESOURCE)) {
            sources = readSources(reader, location(sourcesPath, DEFAULT_SOURCES_RESOURCE));
        } catch (IOException e) {
            throw new MetadataLoadException(location(sourcesPath, DEFAULT_SOURCES_RESOURCE), "cannot read sources", e);
        }

        List<DataSignal> signals;
        try (Reader reader = open(signalsPath, DEFAULT_SIGNALS_RESOURCE)) {
            signals = readSignals(reader, location(signalsPath, DEFAULT_SIGNALS_RESOURCE));
        } catch (IOException e) {
            throw new MetadataLoadException(location(signalsPath, DEFAULT_SIGNALS_RESOURCE), "cannot read signals", e);
        }

        return SignalGraphInitializer.initializeAll(sources, signals);
    }

    public static List<DataSource> readSources(Reader reader, String location) {
        List<DataSource> sources = new ArrayList<>();
        for (Map<String, String> row : readRows(reader, location)) {
            String id = text(row, "source");
            if (id == null) {
                log.warn("Skipping source row without id in {}: {}", location, row);
                continue;
            }
            sources.add(new DataSource(
                id,
                text(row, "db_source"),
                text(row, "name"),
                bool(row, "active"),
                text(row, "description"),
                text(row, "reference_signal"),
                text(row, "license"),
                text(row, "dua"),
                WebLink.parseList(text(row, "link")),
                List.of()
            ));
        }
        log.info("Loaded {} data sources from {}", sources.size(), location);
        return sources;
    }

    public static List<DataSignal> readSignals(Reader reader, String location) {
        List<DataSignal> signals = new ArrayList<>();
        for (Map<String, String> row : readRows(reader, location)) {
            String source = text(row, "source");
            String signal = text(row, "signal");
            if (source == null || signal == null) {
                log.warn("Skipping signal row without source/signal in {}: {}", location, row);
                continue;
            }
            signals.add(new DataSignal(
                source,
                signal,
                text(row, "signal_basename"),
                text(row, "name"),
                text(row, "short_description"),
                text(row, "description"),
                text(row, "time_label"),
                text(row, "value_label"),
                SignalFormat.parse(text(row, "format")),
                SignalCategory.parse(text(row, "category")),
                HighValuesAre.parse(text(row, "high_values_are")),
                bool(row, "is_smoothed"),
                bool(row, "is_weighted"),
                bool(row, "is_cumulative"),
                bool(row, "has_stderr"),
                bool(row, "has_sample_size"),
                bool(row, "compute_from_base"),
                TimeType.fromCode(text(row, "time_type")),
                WebLink.parseList(text(row, "link"))
            ));
        }
        log.info("Loaded {} data signals from {}", signals.size(), location);
        return signals;
    }

    /**
     * Normalize a CSV header to its field name.
     */
    static String cleanColumn(String column) {
        String c = column.toLowerCase(Locale.ROOT).replace(" ", "_").replace("-", "_").strip();
        if (c.equals("source_subdivision")) {
            return "source";
        }
        return c;
    }

    private static List<Map<String, String>> readRows(Reader reader, String location) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, String>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = CSV.readerForMapOf(String.class).with(schema).readValues(reader)) {
            while (it.hasNextValue()) {
                Map<String, String> rawRow = it.nextValue();
                Map<String, String> row = new LinkedHashMap<>();
                rawRow.forEach((k, v) -> row.put(cleanColumn(k), v));
                rows.add(row);
            }
        } catch (IOException | RuntimeException e) {
            throw new MetadataLoadException(location, "malformed CSV: " + e.getMessage(), e);
        }
        return rows;
    }

    private static Reader open(String path, String resource) throws IOException {
        if (path != null && !path.isBlank()) {
            return Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8);
        }
        InputStream in = MetadataLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IOException("classpath resource not found: " + resource);
        }
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }

    private static String location(String path, String resource) {
        return path != null && !path.isBlank() ? path : "classpath:" + resource;
    }

    private static String text(Map<String, String> row, String column) {
        String v = row.get(column);
        if (v == null) return null;
        String trimmed = v.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static boolean bool(Map<String, String> row, String column) {
        String v = text(row, column);
        return v != null && TRUE_VALUES.contains(v.toLowerCase(Locale.ROOT));
    }
}
