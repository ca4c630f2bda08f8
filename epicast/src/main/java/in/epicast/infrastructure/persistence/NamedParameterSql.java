package in.epicast.infrastructure.persistence;

import java.util.ArrayList;
import java.util.List;

/**
 * A query with {@code :name} placeholders rewritten to JDBC {@code ?} markers.
 * Names may repeat; each occurrence becomes its own positional parameter.
 * Quoted literals and {@code ::type} casts are left alone.
 */
public record NamedParameterSql(String sql, List<String> parameterNames) {

    public NamedParameterSql {
        parameterNames = List.copyOf(parameterNames);
    }

    public static NamedParameterSql parse(String namedSql) {
        StringBuilder out = new StringBuilder(namedSql.length());
        List<String> names = new ArrayList<>();
        int n = namedSql.length();
        char quote = 0;
        int i = 0;
        while (i < n) {
            char c = namedSql.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
                out.append(c);
                i++;
                continue;
            }
            if (c == ':' && i + 1 < n && namedSql.charAt(i + 1) == ':') {
                out.append("::");
                i += 2;
                continue;
            }
            if (c == ':' && i + 1 < n && isNameStart(namedSql.charAt(i + 1))) {
                int j = i + 1;
                while (j < n && isNamePart(namedSql.charAt(j))) {
                    j++;
                }
                names.add(namedSql.substring(i + 1, j));
                out.append('?');
                i = j;
                continue;
            }
            out.append(c);
            i++;
        }
        return new NamedParameterSql(out.toString(), names);
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
