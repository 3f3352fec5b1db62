package org.carball.pgsight.report;

import org.carball.pgsight.monitor.InMemoryQueryEventSource;
import org.carball.pgsight.monitor.QueryEvent;
import org.carball.pgsight.monitor.QueryMonitor;

import java.time.Instant;

/**
 * Issues a query from inside the reporting package, the way a diagnostic report would.
 */
public final class FakeReportRunner {

    private FakeReportRunner() {
        // Utility class - prevent instantiation
    }

    public static void runIndexUsageReport(InMemoryQueryEventSource eventSource) {
        Instant started = Instant.now();
        eventSource.publish(QueryMonitor.CHANNEL, QueryEvent.builder()
                .started(started)
                .finished(started.plusMillis(2))
                .sql("SELECT relname, idx_scan FROM pg_stat_user_tables")
                .name("Stat Load")
                .build());
    }

    public static void runThrough(Runnable applicationCall) {
        applicationCall.run();
    }
}
