package org.carball.pgsight.annotation;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgsight.caller.CallerLocator;
import org.carball.pgsight.caller.StackFrameFilter;
import org.carball.pgsight.config.MonitorConfig;
import org.carball.pgsight.model.monitor.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Prepends a source location comment to SQL so the statement can be traced back to the code
 * that issued it, e.g. {@code /*file:com/shop/OrderRepository.java,line:42,method:findOpen*&#47; SELECT ...}.
 * {@link AnnotationParser} reads the comment back.
 */
@Slf4j
public class QueryAnnotator {

    private final boolean enabled;
    private final CallerLocator callerLocator;

    public QueryAnnotator(MonitorConfig config) {
        this(config.isAnnotateQueries(),
                new CallerLocator(config.getCallerFramesToSkip(), config.getCallerFrameLimit(),
                        StackFrameFilter.applicationFrames(config.getFrameworkPatterns())));
    }

    public QueryAnnotator(boolean enabled, CallerLocator callerLocator) {
        this.enabled = enabled;
        this.callerLocator = callerLocator;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Builds the annotation comment for the current caller.
     *
     * @return the comment, or null when annotation is disabled or no application frame was found
     */
    public String buildAnnotation(RequestContext context) {
        if (!enabled) {
            return null;
        }

        SourceLocation location = callerLocator.locate();
        if (location == null) {
            return null;
        }

        List<String> parts = new ArrayList<>();
        parts.add("file:" + location.file());
        parts.add("line:" + location.line());
        if (location.method() != null && !location.method().isBlank()) {
            parts.add("method:" + location.method());
        }

        if (context != null && !context.isEmpty()) {
            parts.add("controller:" + context.controller());
            if (context.action() != null) {
                parts.add("action:" + context.action());
            }
        }

        return "/*" + String.join(",", parts) + "*/";
    }

    /**
     * Returns the statement with an annotation prepended. Statements that already carry a
     * comment are returned unchanged.
     */
    public String annotate(String sql, RequestContext context) {
        if (!enabled || sql == null) {
            return sql;
        }
        if (sql.contains("/*") && sql.contains("*/")) {
            return sql;
        }

        String annotation = buildAnnotation(context);
        if (annotation == null) {
            return sql;
        }
        log.trace("Annotated query with {}", annotation);
        return annotation + " " + sql;
    }
}
