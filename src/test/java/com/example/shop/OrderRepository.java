package com.example.shop;

import org.carball.pgsight.annotation.RequestContext;
import org.carball.pgsight.monitor.InMemoryQueryEventSource;
import org.carball.pgsight.monitor.QueryEvent;
import org.carball.pgsight.monitor.QueryMonitor;

import java.time.Instant;

/**
 * Stands in for application data-access code outside the monitor's packages.
 */
public class OrderRepository {

    public static final String OPEN_ORDERS_SQL = "SELECT * FROM orders WHERE status = 'open'";

    private final InMemoryQueryEventSource eventSource;

    public OrderRepository(InMemoryQueryEventSource eventSource) {
        this.eventSource = eventSource;
    }

    public void findOpenOrders() {
        Instant started = Instant.now();
        eventSource.publish(QueryMonitor.CHANNEL, QueryEvent.builder()
                .started(started)
                .finished(started.plusMillis(4))
                .sql(OPEN_ORDERS_SQL)
                .name("Order Load")
                .context(RequestContext.of("orders", "index"))
                .build());
    }
}
