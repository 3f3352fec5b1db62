package org.carball.pgsight.annotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the small structured comments that query annotators prepend to SQL text.
 *
 * Supported formats:
 * <ul>
 *   <li>PgSight: {@code /*file:app/models/User.java,line:42,method:findActive*&#47;}</li>
 *   <li>Marginalia: {@code /*application:shop,controller:users,action:index*&#47;}</li>
 *   <li>Rails QueryLogs: {@code /*action='index',controller='users'*&#47;}</li>
 * </ul>
 */
public final class AnnotationParser {

    private static final Pattern COMMENT_PATTERN = Pattern.compile("/\\*(.+?)\\*/");

    private static final Pattern STRIP_PATTERN = Pattern.compile("/\\*.+?\\*/\\s*");

    private static final Pattern SINGLE_QUOTED_PAIR = Pattern.compile("(\\w+)='([^']*)'");

    private static final Pattern DOUBLE_QUOTED_PAIR = Pattern.compile("(\\w+)=\"([^\"]*)\"");

    private AnnotationParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Extracts every key/value pair found in the comments of a query. Later comments
     * override earlier ones for the same key.
     */
    public static Map<String, String> parse(String query) {
        if (query == null || query.isEmpty()) {
            return Collections.emptyMap();
        }

        List<String> comments = new ArrayList<>();
        Matcher matcher = COMMENT_PATTERN.matcher(query);
        while (matcher.find()) {
            comments.add(matcher.group(1));
        }

        if (comments.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, String> result = new LinkedHashMap<>();
        for (String comment : comments) {
            result.putAll(parseComment(comment));
        }
        return result;
    }

    /**
     * Removes all annotation comments and surrounding whitespace from a query.
     */
    public static String stripAnnotations(String query) {
        if (query == null) {
            return null;
        }
        return STRIP_PATTERN.matcher(query).replaceAll("").strip();
    }

    /**
     * Renders an annotation as {@code file:line #method controller#action [app]}.
     *
     * @return the display string, or null when the annotation is empty
     */
    public static String formatForDisplay(Map<String, String> annotation) {
        if (annotation == null || annotation.isEmpty()) {
            return null;
        }

        List<String> parts = new ArrayList<>();

        String file = annotation.get("file");
        if (file != null) {
            String line = annotation.get("line");
            parts.add(line != null ? file + ":" + line : file);
        }

        String method = annotation.get("method");
        if (method != null) {
            parts.add("#" + method);
        }

        String controller = annotation.get("controller");
        if (controller != null) {
            String action = annotation.get("action");
            parts.add(action != null ? controller + "#" + action : controller);
        }

        String app = annotation.getOrDefault("app", annotation.get("application"));
        if (app != null) {
            parts.add("[" + app + "]");
        }

        return String.join(" ", parts);
    }

    private static Map<String, String> parseComment(String comment) {
        Map<String, String> result = new LinkedHashMap<>();

        // key:value,key:value
        if (comment.contains(":")) {
            for (String pair : comment.split(",")) {
                String[] keyValue = pair.split(":", 2);
                if (keyValue.length < 2) {
                    continue;
                }
                result.put(normalizeKey(keyValue[0].strip()), keyValue[1].strip());
            }
        }

        // key='value' and key="value"
        if (comment.contains("=")) {
            collectQuotedPairs(SINGLE_QUOTED_PAIR.matcher(comment), result);
            collectQuotedPairs(DOUBLE_QUOTED_PAIR.matcher(comment), result);
        }

        return result;
    }

    private static void collectQuotedPairs(Matcher matcher, Map<String, String> result) {
        while (matcher.find()) {
            result.put(normalizeKey(matcher.group(1)), matcher.group(2));
        }
    }

    private static String normalizeKey(String key) {
        return key.toLowerCase(Locale.ROOT).replaceAll("[-\\s]", "_");
    }
}
