package org.carball.pgsight.caller;

import java.util.List;
import java.util.function.Predicate;

/**
 * Class-name prefix filters over stack frames.
 */
public final class StackFrameFilter {

    private StackFrameFilter() {
        // Utility class - prevent instantiation
    }

    public static Predicate<CallerFrame> matchingAny(List<String> classNamePrefixes) {
        List<String> prefixes = List.copyOf(classNamePrefixes);
        return frame -> prefixes.stream().anyMatch(prefix -> frame.className().startsWith(prefix));
    }

    /**
     * Accepts frames that belong to application code, i.e. match none of the given prefixes.
     */
    public static Predicate<CallerFrame> applicationFrames(List<String> excludedPrefixes) {
        return matchingAny(excludedPrefixes).negate();
    }
}
