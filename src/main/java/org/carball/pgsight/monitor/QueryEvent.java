package org.carball.pgsight.monitor;

import lombok.Builder;
import org.carball.pgsight.annotation.RequestContext;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Notification fired by the host's data-access layer for every executed statement.
 *
 * @param name   logical label supplied by the data layer, e.g. {@code "User Load"}, {@code "SCHEMA"}
 * @param binds  bind parameters; carried for completeness, the monitor ignores them
 * @param context request the statement ran for, or {@link RequestContext#none()}
 */
@Builder
public record QueryEvent(
        Instant started,
        Instant finished,
        String uniqueId,
        String sql,
        String name,
        boolean cached,
        List<Object> binds,
        RequestContext context
) {

    public double durationMs() {
        if (started == null || finished == null) {
            return 0.0;
        }
        double millis = Duration.between(started, finished).toNanos() / 1_000_000.0;
        return Math.round(millis * 100.0) / 100.0;
    }
}
