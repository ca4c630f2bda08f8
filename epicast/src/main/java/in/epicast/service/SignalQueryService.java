package in.epicast.service;

import in.epicast.config.EpicastConfig;
import in.epicast.domain.common.DatabaseErrorException;
import in.epicast.domain.common.ValidationFailedException;
import in.epicast.domain.data.FactRow;
import in.epicast.domain.filter.GeoPair;
import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.domain.filter.TimePair;
import in.epicast.domain.filter.TimeType;
import in.epicast.domain.filter.TimeValue;
import in.epicast.domain.model.SignalKey;
import in.epicast.domain.model.Trend;
import in.epicast.infrastructure.metrics.QueryMetrics;
import in.epicast.repository.FactStore;
import in.epicast.repository.RowCursor;
import in.epicast.service.alias.AliasResolution;
import in.epicast.service.alias.SourceAliasResolver;
import in.epicast.service.derivation.BasenameTransformer;
import in.epicast.service.derivation.DerivationPlan;
import in.epicast.service.derivation.SeriesTransformer;
import in.epicast.service.derivation.TagAndReplayIterator;
import in.epicast.service.derivation.TransformSelector;
import in.epicast.service.metadata.SignalRegistry;
import in.epicast.service.params.RequestParameters;
import in.epicast.service.query.QueryBuilder;
import in.epicast.service.query.ResponseProjection;
import in.epicast.service.query.RevisionSelection;
import in.epicast.service.query.RowParser;
import in.epicast.service.query.SignalQueryRequest;
import in.epicast.service.query.TrendRequest;
import in.epicast.service.trend.TrendCalculator;
import in.epicast.util.TimeValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Read path for versioned signal data.
 *
 * Per request: parse filters, map public sources to storage partitions,
 * rewrite derived signals to their base, build and run the versioned query,
 * then tag, replay and transform the base rows and restore public source ids.
 * The signal registry is the only state shared between requests.
 */
public final class SignalQueryService {
    private static final Logger log = LoggerFactory.getLogger(SignalQueryService.class);

    public static final String QUERY_ENDPOINT = "query";
    public static final String TREND_ENDPOINT = "trend";
    static final String TABLE_ALIAS = "t";

    private final FactStore store;
    private final QueryMetrics metrics;
    private final String factTable;
    private final ResponseProjection projection;

    private final SourceAliasResolver aliasResolver;
    private final BasenameTransformer basenameTransformer;
    private final TransformSelector transformSelector;
    private final SeriesTransformer seriesTransformer;
    private final TrendCalculator trendCalculator;

    public SignalQueryService(SignalRegistry registry, FactStore store, EpicastConfig config, QueryMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
        this.factTable = config.factTable();
        this.projection = ResponseProjection.forMode(config.compatibilityMode());
        this.aliasResolver = new SourceAliasResolver(registry);
        this.basenameTransformer = new BasenameTransformer(registry);
        this.transformSelector = new TransformSelector(registry);
        this.seriesTransformer = new SeriesTransformer(config.smootherWindow());
        this.trendCalculator = new TrendCalculator(config.trendThresholdPct());
    }

    /**
     * Rows matching the request. The caller must close the stream if it stops
     * reading before the end.
     *
     * @throws ValidationFailedException on bad parameters, before any query runs
     * @throws DatabaseErrorException when the storage query fails
     */
    public RowStream query(RequestParameters params) {
        SignalQueryRequest request = validate(QUERY_ENDPOINT, () -> SignalQueryRequest.parse(params));
        return query(request);
    }

    public RowStream query(SignalQueryRequest request) {
        return execute(QUERY_ENDPOINT, request.sourceSignals(), request.geos(), request.times(),
            request.revision(), projection);
    }

    /**
     * Change per (geo_type, geo_value, source, signal) between the anchor and
     * the basis day, over the latest issues in the requested window.
     */
    public List<Trend> trend(RequestParameters params) {
        TrendRequest request = validate(TREND_ENDPOINT, () -> TrendRequest.parse(params));
        return trend(request);
    }

    public List<Trend> trend(TrendRequest request) {
        Map<SeriesGroup, List<FactRow>> groups = new LinkedHashMap<>();
        try (RowStream rows = execute(TREND_ENDPOINT, request.sourceSignals(), request.geos(), request.times(),
                RevisionSelection.latest(), ResponseProjection.STANDARD)) {
            while (rows.hasNext()) {
                FactRow row = rows.next();
                groups.computeIfAbsent(SeriesGroup.of(row), k -> new ArrayList<>()).add(row);
            }
        }

        List<Trend> trends = new ArrayList<>(groups.size());
        groups.forEach((group, series) -> trends.add(trendCalculator.compute(
            group.geoType(), group.geoValue(), group.source(), group.signal(),
            series, request.date(), request.basis())));
        log.info("[TREND] {} series, anchor {} basis {}", trends.size(), request.date(), request.basis());
        return trends;
    }

    // ───────────────────────────────────────────────────────────────

    private RowStream execute(String endpoint, List<SourceSignalPair> pairs, List<GeoPair> geos,
                              List<TimePair> times, RevisionSelection revision, ResponseProjection shape) {
        AliasResolution aliases = aliasResolver.resolve(pairs);
        DerivationPlan plan = basenameTransformer.derivePlan(aliases.pairs());
        int lookback = lookback(plan);
        List<TimePair> queryTimes = lookback > 0 ? widen(times, lookback) : times;

        QueryBuilder builder = shape.configure(new QueryBuilder(factTable, TABLE_ALIAS))
            .whereSourceSignalPairs(FactRow.SOURCE, FactRow.SIGNAL, plan.basePairs())
            .whereGeoPairs(FactRow.GEO_TYPE, FactRow.GEO_VALUE, geos)
            .whereTimePairs(FactRow.TIME_TYPE, FactRow.TIME_VALUE, queryTimes)
            .applyRevision(revision);
        String sql = builder.toSql();

        log.info("[{}] {} signals requested, {} base pairs, {} replay groups, revision {}{}",
            endpoint.toUpperCase(Locale.ROOT), SourceSignalPair.countSignals(pairs), plan.basePairs().size(),
            plan.replayTable().size(), builder.revisionMode(), aliases.usesAlias() ? ", aliased" : "");
        if (lookback > 0) {
            log.debug("[{}] Base time filter widened by {} steps: {}", endpoint.toUpperCase(Locale.ROOT),
                lookback, queryTimes);
        }
        log.debug("SQL: {} params: {}", sql, builder.params());

        RowCursor cursor = open(endpoint, sql, builder.params());
        RowParser parser = builder.rowParser();
        Iterator<FactRow> baseRows = new ParsingIterator(cursor, parser);
        TagAndReplayIterator<FactRow> tagged = new TagAndReplayIterator<>(baseRows, plan.replayTable(),
            row -> SignalKey.of(row.source(), row.signal()));
        Predicate<FactRow> requested = lookback > 0 ? row -> inTimes(times, row) : row -> true;
        DerivedRowIterator derived = new DerivedRowIterator(tagged, transformSelector, seriesTransformer,
            aliases.mapperOrIdentity(), shape, requested);

        return new RowStream(derived, cursor, () -> {
            metrics.recordRows(QueryMetrics.PASSTHROUGH, derived.passThroughCount());
            metrics.recordRows(QueryMetrics.REPLAYED, derived.replayedCount());
            log.debug("[{}] emitted {} pass-through and {} replayed rows",
                endpoint.toUpperCase(Locale.ROOT), derived.passThroughCount(), derived.replayedCount());
        });
    }

    /**
     * Largest number of earlier time steps any replayed transform reads.
     */
    private int lookback(DerivationPlan plan) {
        int steps = 0;
        for (SignalKey base : plan.replayTable().keys()) {
            for (SignalKey target : plan.replayTable().targetsOf(base)) {
                if (!target.equals(base)) {
                    steps = Math.max(steps, seriesTransformer.lookback(transformSelector.select(target)));
                }
            }
        }
        return steps;
    }

    /**
     * Extend every point and range back by {@code steps} time steps of its own time type.
     */
    static List<TimePair> widen(List<TimePair> times, int steps) {
        List<TimePair> out = new ArrayList<>(times.size());
        for (TimePair pair : times) {
            if (pair.allValues()) {
                out.add(pair);
                continue;
            }
            List<TimeValue> values = new ArrayList<>(pair.timeValues().size());
            for (TimeValue tv : pair.timeValues()) {
                values.add(TimeValue.range(TimeValues.shift(pair.timeType(), tv.start(), -steps), tv.end()));
            }
            out.add(TimePair.of(pair.timeType(), values));
        }
        return out;
    }

    private static boolean inTimes(List<TimePair> times, FactRow row) {
        TimeType type = TimeType.fromCode(row.getString(FactRow.TIME_TYPE));
        Integer value = row.getInteger(FactRow.TIME_VALUE);
        if (type == null || value == null) {
            return false;
        }
        for (TimePair pair : times) {
            if (pair.matches(type, value)) {
                return true;
            }
        }
        return false;
    }

    private RowCursor open(String endpoint, String sql, Map<String, Object> params) {
        long start = System.nanoTime();
        try {
            RowCursor cursor = store.execute(sql, params);
            metrics.recordQuery(endpoint, true, Duration.ofNanos(System.nanoTime() - start));
            return cursor;
        } catch (DatabaseErrorException e) {
            metrics.recordQuery(endpoint, false, Duration.ofNanos(System.nanoTime() - start));
            throw e;
        } catch (RuntimeException e) {
            metrics.recordQuery(endpoint, false, Duration.ofNanos(System.nanoTime() - start));
            log.error("[{}] Storage failure: {}", endpoint.toUpperCase(Locale.ROOT), e.getMessage());
            throw new DatabaseErrorException("database error: " + e.getMessage(), sql, e);
        }
    }

    private <T> T validate(String endpoint, Supplier<T> parse) {
        try {
            return parse.get();
        } catch (ValidationFailedException e) {
            metrics.recordValidationFailure(endpoint);
            log.info("[{}] Rejected request: {}", endpoint.toUpperCase(Locale.ROOT), e.getMessage());
            throw e;
        }
    }

    private record SeriesGroup(String geoType, String geoValue, String source, String signal) {
        static SeriesGroup of(FactRow row) {
            return new SeriesGroup(row.getString(FactRow.GEO_TYPE), row.getString(FactRow.GEO_VALUE),
                row.source(), row.signal());
        }
    }

    /**
     * Storage rows cast to the typed field lists of the query.
     */
    private static final class ParsingIterator implements Iterator<FactRow> {
        private final RowCursor cursor;
        private final RowParser parser;

        ParsingIterator(RowCursor cursor, RowParser parser) {
            this.cursor = cursor;
            this.parser = parser;
        }

        @Override
        public boolean hasNext() {
            return cursor.hasNext();
        }

        @Override
        public FactRow next() {
            if (!cursor.hasNext()) {
                throw new NoSuchElementException();
            }
            Map<String, Object> raw = cursor.next();
            try {
                return parser.parse(raw);
            } catch (IllegalArgumentException e) {
                throw new DatabaseErrorException("malformed row from storage: " + e.getMessage(), e);
            }
        }
    }
}
