package org.carball.pgsight.caller;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgsight.model.monitor.SourceLocation;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Finds the application code that triggered a query by walking the current call stack.
 */
@Slf4j
public class CallerLocator {

    private final Supplier<List<CallerFrame>> stackSupplier;
    private final int framesToSkip;
    private final Predicate<CallerFrame> applicationFrameFilter;

    public CallerLocator(int framesToSkip, int frameLimit, Predicate<CallerFrame> applicationFrameFilter) {
        this(() -> currentStack(frameLimit), framesToSkip, applicationFrameFilter);
    }

    public CallerLocator(Supplier<List<CallerFrame>> stackSupplier, int framesToSkip,
                         Predicate<CallerFrame> applicationFrameFilter) {
        this.stackSupplier = stackSupplier;
        this.framesToSkip = Math.max(0, framesToSkip);
        this.applicationFrameFilter = applicationFrameFilter;
    }

    /**
     * Returns the first frame after the skipped ones accepted by the filter, or null when
     * none qualifies.
     */
    public SourceLocation locate() {
        try {
            return frames().stream()
                    .skip(framesToSkip)
                    .filter(applicationFrameFilter)
                    .findFirst()
                    .map(frame -> new SourceLocation(frame.path(), frame.lineNumber(), frame.methodName()))
                    .orElse(null);
        } catch (RuntimeException e) {
            log.debug("Source location extraction failed", e);
            return null;
        }
    }

    public List<CallerFrame> frames() {
        return stackSupplier.get();
    }

    public static List<CallerFrame> currentStack(int frameLimit) {
        return StackWalker.getInstance().walk(frames -> frames
                .limit(frameLimit)
                .map(CallerFrame::from)
                .collect(Collectors.toList()));
    }
}
