package in.epicast.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Documentation link attached to a source or signal.
 */
public record WebLink(String alt, String href) {

    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[(.+)\\]\\s*\\((.*)\\)");
    static final String DEFAULT_ALT = "API Documentation";

    /**
     * Parse a comma-separated list of markdown links ({@code [alt](href)}).
     * A bare entry is taken as the href of an "API Documentation" link.
     */
    public static List<WebLink> parseList(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<WebLink> links = new ArrayList<>();
        for (String part : text.split(",")) {
            String entry = part.trim();
            if (entry.isEmpty()) {
                continue;
            }
            Matcher m = MARKDOWN_LINK.matcher(entry);
            if (m.matches()) {
                links.add(new WebLink(m.group(1), m.group(2)));
            } else {
                links.add(new WebLink(DEFAULT_ALT, entry));
            }
        }
        return List.copyOf(links);
    }
}
