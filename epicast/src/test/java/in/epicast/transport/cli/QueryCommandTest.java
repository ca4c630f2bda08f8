package in.epicast.transport.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.epicast.config.EpicastConfig;
import in.epicast.infrastructure.metrics.QueryMetrics;
import in.epicast.repository.FactStore;
import in.epicast.repository.RowCursor;
import in.epicast.service.SignalQueryService;
import in.epicast.service.metadata.TestRegistries;
import in.epicast.service.params.RequestParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.StringWriter;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryCommandTest {

    @Mock
    private FactStore store;

    private QueryCommand command;

    @BeforeEach
    void setUp() {
        EpicastConfig config = new EpicastConfig("jdbc:test", "user", "pass", 1, "covidcast",
            null, null, false, 10.0, 7, 9091);
        SignalQueryService service = new SignalQueryService(TestRegistries.fixture(), store, config, QueryMetrics.NOOP);
        command = new QueryCommand(service);
    }

    private static Map<String, Object> raw(String geoValue, int day, double value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("source", "src-b");
        row.put("signal", "daily");
        row.put("geo_type", "state");
        row.put("geo_value", geoValue);
        row.put("time_type", "day");
        row.put("time_value", day);
        row.put("issue", day);
        row.put("lag", 0);
        row.put("value", value);
        row.put("stderr", null);
        row.put("sample_size", null);
        return row;
    }

    private void stubRows(List<Map<String, Object>> rows) {
        Iterator<Map<String, Object>> it = rows.iterator();
        when(store.execute(anyString(), anyMap())).thenReturn(new RowCursor() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Map<String, Object> next() {
                return it.next();
            }

            @Override
            public void close() {
            }
        });
    }

    @Test
    void testParseParamsGroupsRepeatedNames() {
        RequestParameters params = QueryCommand.parseParams(new String[] {
            "signal=src-a:cum", "signal=src-b:daily", "geo=state:ca", "as_of="});

        assertEquals(List.of("src-a:cum", "src-b:daily"), params.getAll("signal"));
        assertEquals("state:ca", params.get("geo"));
        assertTrue(params.has("as_of"));
        assertFalse(params.hasValue("as_of"));
    }

    @Test
    void testParseParamsRejectsBareWords() {
        assertThrows(IllegalArgumentException.class, () -> QueryCommand.parseParams(new String[] {"signal"}));
        assertThrows(IllegalArgumentException.class, () -> QueryCommand.parseParams(new String[] {"=x"}));
    }

    @Test
    void testQueryWritesJsonLines() throws Exception {
        stubRows(List.of(raw("ca", 20200401, 3), raw("ca", 20200402, 4)));
        StringWriter out = new StringWriter();

        long count = command.run(new String[] {
            "query", "signal=src-b:daily", "geo=state:ca", "time=day:20200401-20200402"}, out);

        assertEquals(2, count);
        String[] lines = out.toString().split("\n");
        assertEquals(2, lines.length);
        JsonNode first = new ObjectMapper().readTree(lines[0]);
        assertEquals("src-b", first.get("source").asText());
        assertEquals(20200401, first.get("time_value").asInt());
        assertEquals(3.0, first.get("value").asDouble());
        assertTrue(first.get("stderr").isNull());
    }

    @Test
    void testTrendWritesOneLinePerSeries() throws Exception {
        stubRows(List.of(raw("ca", 20200401, 100), raw("ca", 20200408, 150)));
        StringWriter out = new StringWriter();

        long count = command.run(new String[] {
            "trend", "signal=src-b:daily", "geo=state:ca", "window=20200401-20200408"}, out);

        assertEquals(1, count);
        JsonNode trend = new ObjectMapper().readTree(out.toString().trim());
        assertEquals("ca", trend.get("geoValue").asText());
        assertEquals(50.0, trend.get("pctChange").asDouble());
        assertEquals("INCREASING", trend.get("direction").asText());
    }

    @Test
    void testUnknownCommandIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> command.run(new String[] {"export", "signal=src-b:daily"}, new StringWriter()));
        verifyNoInteractions(store);
    }
}
