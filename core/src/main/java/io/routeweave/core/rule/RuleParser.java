package io.routeweave.core.rule;

/**
 * Extracts a routable host (or SNI) value from a proxy router rule
 * expression.
 *
 * <p>
 * Supported syntaxes, tried in order:
 * <ol>
 * <li>{@code Host(`example.com`)}</li>
 * <li>{@code HostRegexp(`pattern`)}: {@code .+} yields {@link #ANY_HOST},
 * other patterns are simplified into a readable approximation</li>
 * <li>legacy {@code Host:example.com}, terminated by a space, comma or
 * closing parenthesis</li>
 * <li>{@code &&}-composed rules: each operand is tried in turn</li>
 * </ol>
 *
 * <p>
 * No input ever throws. Anything that cannot be parsed yields the empty
 * string, which callers treat as "skip this route".
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class RuleParser {

    /** Placeholder returned for the catch-all {@code HostRegexp(`.+`)}. */
    public static final String ANY_HOST = "any-host";

    private static final String HOST = "Host(`";
    private static final String HOST_REGEXP = "HostRegexp(`";
    private static final String LEGACY_HOST = "Host:";
    private static final String HOST_SNI = "HostSNI(`";
    private static final String HOST_SNI_REGEXP = "HostSNIRegexp(`";

    /**
     * Regex fragments and their readable replacements. Applied in order, so
     * multi-character classes must come before the bare metacharacters.
     */
    private static final String[][] REGEX_REPLACEMENTS = {
        {"\\d+", "N"},
        {"[0-9]+", "N"},
        {"[a-z0-9]+", "x"},
        {"[a-zA-Z0-9]+", "x"},
        {"[a-z]+", "x"},
        {"[A-Z]+", "X"},
        {"[a-zA-Z]+", "X"},
        {"\\w+", "x"},
        {"[^/]+", "x"},
        {".*", "x"},
        {".+", "x"},
        {"^", ""},
        {"$", ""},
        {"\\", ""},
        {"(", ""},
        {")", ""},
        {"{", ""},
        {"}", ""},
        {"[", ""},
        {"]", ""},
        {"?", ""},
        {"*", ""},
        {"+", ""},
        {"|", "-"},
    };

    private RuleParser() {
        // utility class
    }

    /**
     * Extracts the host from an HTTP router rule.
     *
     * @param rule the rule expression, may be null
     * @return the host, {@link #ANY_HOST} for a catch-all regexp, or an empty
     *         string when nothing could be extracted
     */
    public static String extractHost(String rule) {
        if (rule == null || rule.isBlank()) {
            return "";
        }

        String host = quotedArgument(rule, HOST);
        if (host != null) {
            return host;
        }

        String pattern = quotedArgument(rule, HOST_REGEXP);
        if (pattern != null) {
            return ".+".equals(pattern) ? ANY_HOST : simplifyPattern(pattern);
        }

        String legacy = legacyHost(rule);
        if (!legacy.isEmpty()) {
            return legacy;
        }

        if (rule.contains("&&")) {
            for (String part : rule.split("&&")) {
                String candidate = extractHost(part.trim());
                if (!candidate.isEmpty()) {
                    return candidate;
                }
            }
        }
        return "";
    }

    /**
     * Extracts the SNI host from a TCP router rule such as
     * {@code HostSNI(`db.example.com`)}.
     *
     * @param rule the rule expression, may be null
     * @return the SNI host or an empty string
     */
    public static String extractHostSni(String rule) {
        if (rule == null) {
            return "";
        }
        String host = quotedArgument(rule, HOST_SNI);
        return host != null ? host : "";
    }

    /**
     * Extracts a readable approximation of the pattern in a
     * {@code HostSNIRegexp(`...`)} rule.
     *
     * @param rule the rule expression, may be null
     * @return the simplified pattern or an empty string
     */
    public static String extractHostSniRegexp(String rule) {
        if (rule == null) {
            return "";
        }
        String pattern = quotedArgument(rule, HOST_SNI_REGEXP);
        return pattern != null ? simplifyPattern(pattern) : "";
    }

    /**
     * Extracts the TCP-plane host: a literal {@code HostSNI} first, then a
     * simplified {@code HostSNIRegexp}.
     *
     * @param rule the rule expression, may be null
     * @return the SNI host or an empty string
     */
    public static String extractSniHost(String rule) {
        String host = extractHostSni(rule);
        return host.isEmpty() ? extractHostSniRegexp(rule) : host;
    }

    /**
     * Turns a host regular expression into a readable, host-like string.
     * The result is cosmetic: it is stable for a given input but is not a
     * faithful rendering of the regular expression.
     */
    static String simplifyPattern(String pattern) {
        String result = pattern;
        for (String[] replacement : REGEX_REPLACEMENTS) {
            result = result.replace(replacement[0], replacement[1]);
        }
        return result;
    }

    /**
     * Returns the text between {@code prefix} and the next backtick, or null
     * when the prefix is absent or the argument is unterminated.
     */
    private static String quotedArgument(String rule, String prefix) {
        int start = rule.indexOf(prefix);
        if (start < 0) {
            return null;
        }
        start += prefix.length();
        int end = rule.indexOf('`', start);
        if (end < 0) {
            return null;
        }
        return rule.substring(start, end);
    }

    private static String legacyHost(String rule) {
        int start = rule.indexOf(LEGACY_HOST);
        if (start < 0) {
            return "";
        }
        start += LEGACY_HOST.length();
        int end = start;
        while (end < rule.length()) {
            char c = rule.charAt(end);
            if (c == ' ' || c == ',' || c == ')') {
                break;
            }
            end++;
        }
        return rule.substring(start, end);
    }
}
