package in.epicast.transport.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import in.epicast.domain.model.Trend;
import in.epicast.service.RowStream;
import in.epicast.service.SignalQueryService;
import in.epicast.service.params.RequestParameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One-shot command line access to the read path.
 *
 * <pre>
 * query signal=src:sig geo=state:ca time=day:20200401-20200410 [as_of=20200415]
 * trend signal=src:sig geo=state:* window=20200401-20200430 date=20200430
 * </pre>
 *
 * Rows are written as JSON lines.
 */
public final class QueryCommand {

    private final SignalQueryService service;
    private final ObjectMapper mapper;

    public QueryCommand(SignalQueryService service) {
        this.service = service;
        this.mapper = new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * @return number of rows written
     */
    public long run(String[] args, Writer out) {
        if (args.length == 0) {
            throw new IllegalArgumentException("usage: (query|trend) name=value...");
        }
        String command = args[0];
        String[] rest = new String[args.length - 1];
        System.arraycopy(args, 1, rest, 0, rest.length);
        RequestParameters params = parseParams(rest);

        try {
            switch (command) {
                case "query": {
                    long count = 0;
                    try (RowStream rows = service.query(params)) {
                        while (rows.hasNext()) {
                            writeLine(out, rows.next().asMap());
                            count++;
                        }
                    }
                    out.flush();
                    return count;
                }
                case "trend": {
                    List<Trend> trends = service.trend(params);
                    for (Trend trend : trends) {
                        writeLine(out, trend);
                    }
                    out.flush();
                    return trends.size();
                }
                default:
                    throw new IllegalArgumentException("unknown command: " + command);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static RequestParameters parseParams(String[] args) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("expected name=value, got: " + arg);
            }
            params.computeIfAbsent(arg.substring(0, eq), k -> new ArrayList<>()).add(arg.substring(eq + 1));
        }
        return new RequestParameters(params);
    }

    private void writeLine(Writer out, Object value) throws IOException {
        out.write(mapper.writeValueAsString(value));
        out.write('\n');
    }
}
