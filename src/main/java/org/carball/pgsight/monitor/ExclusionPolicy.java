package org.carball.pgsight.monitor;

import org.carball.pgsight.caller.CallerFrame;
import org.carball.pgsight.caller.CallerLocator;
import org.carball.pgsight.caller.StackFrameFilter;
import org.carball.pgsight.config.MonitorConfig;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Decides which query events the monitor ignores. Checks run in a fixed order and the first
 * match wins; the monitor's own activity must never be captured, application queries always must.
 */
public class ExclusionPolicy {

    public enum SkipReason {
        SELF_LABEL,
        SELF_ORIGIN,
        SCHEMA,
        CACHED,
        EXPLAIN,
        DDL
    }

    static final String SCHEMA_LABEL = "SCHEMA";
    static final String CACHE_LABEL = "CACHE";

    private static final Pattern EXPLAIN_PATTERN = Pattern.compile("\\bEXPLAIN\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DDL_PATTERN = Pattern.compile("\\b(CREATE|ALTER|DROP)\\b", Pattern.CASE_INSENSITIVE);

    private final String selfLabelPrefix;
    private final Supplier<List<CallerFrame>> stackSupplier;
    private final Predicate<CallerFrame> selfOrigin;
    private final Predicate<CallerFrame> ignored;

    public ExclusionPolicy(String selfLabelPrefix,
                           Supplier<List<CallerFrame>> stackSupplier,
                           List<String> excludedSourcePatterns,
                           List<String> ignoredSourcePatterns) {
        this.selfLabelPrefix = selfLabelPrefix;
        this.stackSupplier = stackSupplier;
        this.selfOrigin = StackFrameFilter.matchingAny(excludedSourcePatterns);
        this.ignored = StackFrameFilter.matchingAny(ignoredSourcePatterns);
    }

    public static ExclusionPolicy fromConfig(MonitorConfig config) {
        int frameLimit = config.getSelfOriginFrameLimit();
        return new ExclusionPolicy(
                config.getSelfLabelPrefix(),
                () -> CallerLocator.currentStack(frameLimit),
                config.getExcludedSourcePatterns(),
                config.getIgnoredSourcePatterns());
    }

    public boolean shouldSkip(QueryEvent event) {
        return skipReason(event) != null;
    }

    /**
     * @return why the event is ignored, or null when it should be captured
     */
    public SkipReason skipReason(QueryEvent event) {
        String name = event.name();
        String sql = event.sql();

        if (name != null && selfLabelPrefix != null && !selfLabelPrefix.isEmpty()
                && name.startsWith(selfLabelPrefix)) {
            return SkipReason.SELF_LABEL;
        }

        if (originatesFromMonitor()) {
            return SkipReason.SELF_ORIGIN;
        }

        if (name != null && name.startsWith(SCHEMA_LABEL)) {
            return SkipReason.SCHEMA;
        }

        if (CACHE_LABEL.equals(name) || event.cached()) {
            return SkipReason.CACHED;
        }

        if (sql != null && EXPLAIN_PATTERN.matcher(sql).find()) {
            return SkipReason.EXPLAIN;
        }

        if (sql != null && DDL_PATTERN.matcher(sql).find()) {
            return SkipReason.DDL;
        }

        return null;
    }

    /**
     * True when the reporting code itself is on the call stack. Ignored frames (the monitor
     * class, the dashboard) never count, so dashboard-triggered application queries stay visible.
     */
    boolean originatesFromMonitor() {
        List<CallerFrame> frames = stackSupplier.get();
        if (frames == null) {
            return false;
        }
        return frames.stream()
                .filter(ignored.negate())
                .anyMatch(selfOrigin);
    }
}
