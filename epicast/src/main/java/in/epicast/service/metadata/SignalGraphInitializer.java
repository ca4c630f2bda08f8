package in.epicast.service.metadata;

import in.epicast.domain.filter.TimeType;
import in.epicast.domain.model.DataSignal;
import in.epicast.domain.model.DataSource;
import in.epicast.domain.model.HighValuesAre;
import in.epicast.domain.model.SignalCategory;
import in.epicast.domain.model.SignalFormat;
import in.epicast.domain.model.SignalKey;
import in.epicast.domain.model.WebLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the {@link SignalRegistry} from raw source and signal definitions.
 *
 * Each signal is initialized exactly once, after its basename signal
 * (depth-first, memoized by key). Initialization fills empty descriptive fields
 * from the basename signal, then substitutes placeholder tokens in
 * name, short description and description, in that order.
 *
 * Missing basenames, missing sources and malformed chains are logged and
 * tolerated; the affected fields keep their literal values.
 */
public final class SignalGraphInitializer {
    private static final Logger log = LoggerFactory.getLogger(SignalGraphInitializer.class);

    static final String NO_DESCRIPTION = "No description available";
    static final String DEFAULT_VALUE_LABEL = "Value";
    private static final int SHORT_DESCRIPTION_LENGTH = 10;
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    private final Map<String, DataSource> sourcesById = new LinkedHashMap<>();
    private final Map<SignalKey, DataSignal> raw = new LinkedHashMap<>();
    private final Map<SignalKey, DataSignal> initialized = new HashMap<>();
    private final Set<SignalKey> visiting = new HashSet<>();
    private final List<String> warnings = new ArrayList<>();

    private SignalGraphInitializer(List<DataSource> sources, List<DataSignal> signals) {
        for (DataSource source : sources) {
            if (sourcesById.putIfAbsent(source.source(), source) != null) {
                warn("duplicate source definition ignored: {}", source.source());
            }
        }
        for (DataSignal signal : signals) {
            if (raw.putIfAbsent(signal.key(), signal) != null) {
                warn("duplicate signal definition ignored: {}", signal.key());
            }
        }
    }

    /**
     * Initialize every signal and attach it to its owning source.
     */
    public static SignalRegistry initializeAll(List<DataSource> sources, List<DataSignal> signals) {
        SignalGraphInitializer init = new SignalGraphInitializer(sources, signals);
        return init.build();
    }

    private SignalRegistry build() {
        List<DataSignal> done = new ArrayList<>(raw.size());
        for (SignalKey key : raw.keySet()) {
            done.add(initialize(key));
        }

        Map<String, List<DataSignal>> bySource = new LinkedHashMap<>();
        for (DataSignal signal : done) {
            if (sourcesById.containsKey(signal.source())) {
                bySource.computeIfAbsent(signal.source(), k -> new ArrayList<>()).add(signal);
            }
        }

        List<DataSource> sources = new ArrayList<>(sourcesById.size());
        for (DataSource source : sourcesById.values()) {
            sources.add(source.withSignals(bySource.getOrDefault(source.source(), List.of())));
        }

        log.info("Signal metadata initialized: {} sources, {} signals, {} warnings",
            sources.size(), done.size(), warnings.size());
        return new SignalRegistry(sources, done, warnings);
    }

    private DataSignal initialize(SignalKey key) {
        DataSignal done = initialized.get(key);
        if (done != null) {
            return done;
        }
        DataSignal signal = raw.get(key);
        visiting.add(key);

        DataSignal base = null;
        if (!signal.isOwnBase()) {
            SignalKey baseKey = signal.baseKey();
            if (!raw.containsKey(baseKey)) {
                warn("basename signal {} of {} is not registered", baseKey, key);
            } else if (visiting.contains(baseKey)) {
                warn("cyclic basename chain at {} -> {}", key, baseKey);
                base = raw.get(baseKey);
            } else {
                base = initialize(baseKey);
            }
            if (base != null && signal.computeFromBase() && base.computeFromBase()) {
                warn("{} is computed from {} which is itself computed from {}",
                    key, baseKey, base.signalBasename());
            }
        }

        DataSource source = sourcesById.get(signal.source());
        if (source == null) {
            warn("source {} of signal {} is not registered", signal.source(), key);
        }

        DataSignal result = replacePlaceholders(applyDefaults(signal, base), base, source);
        visiting.remove(key);
        initialized.put(key, result);
        return result;
    }

    static DataSignal applyDefaults(DataSignal s, DataSignal base) {
        String name = s.name();
        if (isBlank(name)) {
            name = base != null ? base.name() : s.signal();
        }

        String description = s.description();
        if (isBlank(description)) {
            if (base != null) {
                description = firstNonBlank(base.description(), base.shortDescription(), NO_DESCRIPTION);
            } else {
                description = firstNonBlank(s.shortDescription(), NO_DESCRIPTION);
            }
        }

        String shortDescription = s.shortDescription();
        if (isBlank(shortDescription)) {
            if (base != null) {
                shortDescription = firstNonBlank(base.shortDescription(),
                    isBlank(base.description()) ? null : truncate(base.description()),
                    NO_DESCRIPTION);
            } else {
                shortDescription = truncate(description);
            }
        }

        List<WebLink> links = s.links();
        if (links.isEmpty() && base != null) {
            links = base.links();
        }

        String valueLabel = s.valueLabel();
        if (isBlank(valueLabel)) {
            valueLabel = base != null ? base.valueLabel() : DEFAULT_VALUE_LABEL;
        }

        SignalCategory category = s.category();
        if (category == null) {
            category = base != null && base.category() != null ? base.category() : SignalCategory.OTHER;
        }

        HighValuesAre highValuesAre = s.highValuesAre();
        if (highValuesAre == null) {
            highValuesAre = base != null && base.highValuesAre() != null ? base.highValuesAre() : HighValuesAre.NEUTRAL;
        }

        SignalFormat format = s.format();
        if (format == null) {
            format = base != null && base.format() != null ? base.format() : SignalFormat.RAW;
        }

        TimeType timeType = s.timeType();
        if (timeType == null) {
            timeType = base != null && base.timeType() != null ? base.timeType() : TimeType.DAY;
        }

        return s.withDescriptives(name, shortDescription, description, valueLabel, format,
            category, highValuesAre, timeType, links);
    }

    private DataSignal replacePlaceholders(DataSignal s, DataSignal base, DataSource source) {
        Map<String, String> tokens = new HashMap<>();
        tokens.put("base_description", base != null ? nullToEmpty(base.description()) : "");
        tokens.put("base_short_description", base != null ? nullToEmpty(base.shortDescription()) : "");
        tokens.put("base_name", base != null ? nullToEmpty(base.name()) : "");
        tokens.put("source_name", source != null ? nullToEmpty(source.name()) : "");
        tokens.put("source_description", source != null ? nullToEmpty(source.description()) : "");

        Set<String> unknown = new LinkedHashSet<>();
        String name = substitute(s.name(), tokens, unknown);
        tokens.put("name", name);
        String shortDescription = substitute(s.shortDescription(), tokens, unknown);
        tokens.put("short_description", shortDescription);
        String description = substitute(s.description(), tokens, unknown);
        for (String token : unknown) {
            warn("unknown placeholder {{}} in {}", token, s.key());
        }

        return s.withDescriptives(name, shortDescription, description, s.valueLabel(), s.format(),
            s.category(), s.highValuesAre(), s.timeType(), s.links());
    }

    /**
     * Replace {token} occurrences; unknown tokens are kept verbatim and their
     * names added to {@code unknown}.
     */
    static String substitute(String text, Map<String, String> tokens, Set<String> unknown) {
        if (text == null || text.indexOf('{') < 0) {
            return text;
        }
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = tokens.get(m.group(1));
            if (value == null) {
                unknown.add(m.group(1));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group(0)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private void warn(String format, Object... args) {
        log.warn("Metadata: " + format, args);
        warnings.add(String.format(format.replace("{}", "%s"), args));
    }

    private static String truncate(String text) {
        return text.length() <= SHORT_DESCRIPTION_LENGTH ? text : text.substring(0, SHORT_DESCRIPTION_LENGTH);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (!isBlank(v)) {
                return v;
            }
        }
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
