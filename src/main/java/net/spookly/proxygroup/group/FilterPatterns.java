package net.spookly.proxygroup.group;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles a group's filter string. Patterns are separated by a backtick and applied in order.
 */
public final class FilterPatterns {
    public static final String SEPARATOR = "`";

    private FilterPatterns() {
    }

    /**
     * Compile every non-blank segment; an empty or null filter yields no patterns.
     *
     * @throws IllegalArgumentException when a segment is not a valid regular expression
     */
    public static List<Pattern> compile(String filter) {
        if (filter == null || filter.isEmpty()) {
            return List.of();
        }
        List<Pattern> patterns = new ArrayList<>();
        for (String segment : filter.split(SEPARATOR, -1)) {
            if (segment.isBlank()) {
                continue;
            }
            try {
                patterns.add(Pattern.compile(segment));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid filter pattern '" + segment + "': " + e.getDescription(), e);
            }
        }
        return List.copyOf(patterns);
    }
}
