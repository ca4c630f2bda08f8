package in.epicast.infrastructure.persistence;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamedParameterSqlTest {

    @Test
    void testNamesBecomePositionalMarkers() {
        NamedParameterSql parsed = NamedParameterSql.parse(
            "SELECT * FROM t WHERE a = :source_0 AND b IN (:source_0_signal_0, :source_0_signal_1) AND c = :source_0");

        assertEquals("SELECT * FROM t WHERE a = ? AND b IN (?, ?) AND c = ?", parsed.sql());
        assertEquals(List.of("source_0", "source_0_signal_0", "source_0_signal_1", "source_0"), parsed.parameterNames());
    }

    @Test
    void testQuotedTextAndCastsAreLeftAlone() {
        NamedParameterSql parsed = NamedParameterSql.parse(
            "SELECT ':not_a_param', \"col:x\", v::text FROM t WHERE d = :as_of");

        assertEquals("SELECT ':not_a_param', \"col:x\", v::text FROM t WHERE d = ?", parsed.sql());
        assertEquals(List.of("as_of"), parsed.parameterNames());
    }

    @Test
    void testNoParameters() {
        NamedParameterSql parsed = NamedParameterSql.parse("SELECT 1");

        assertEquals("SELECT 1", parsed.sql());
        assertTrue(parsed.parameterNames().isEmpty());
    }
}
