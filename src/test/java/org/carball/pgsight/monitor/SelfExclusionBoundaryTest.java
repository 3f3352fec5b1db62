package org.carball.pgsight.monitor;

import com.example.shop.OrderRepository;
import org.carball.pgsight.config.MonitorConfig;
import org.carball.pgsight.dashboard.FakeDashboardController;
import org.carball.pgsight.model.monitor.CapturedQuery;
import org.carball.pgsight.report.FakeReportRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exercises the self-exclusion rules against the real call stack.
 */
class SelfExclusionBoundaryTest {

    private InMemoryQueryEventSource eventSource;
    private QueryMonitor monitor;

    @BeforeEach
    void setUp() {
        eventSource = new InMemoryQueryEventSource();
        monitor = new QueryMonitor(MonitorConfig.defaults(), eventSource);
        monitor.start();
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
        monitor.close();
    }

    @Test
    void shouldSkipQueriesIssuedByReportCode() {
        // When
        FakeReportRunner.runIndexUsageReport(eventSource);

        // Then
        assertThat(monitor.queries()).isEmpty();
    }

    @Test
    void shouldSkipApplicationQueriesRunFromInsideReportCode() {
        OrderRepository repository = new OrderRepository(eventSource);

        FakeReportRunner.runThrough(repository::findOpenOrders);

        assertThat(monitor.queries()).isEmpty();
    }

    @Test
    void shouldCaptureApplicationQueriesTriggeredFromDashboard() {
        // Given
        OrderRepository repository = new OrderRepository(eventSource);

        // When
        FakeDashboardController.rerun(repository::findOpenOrders);

        // Then
        List<CapturedQuery> queries = monitor.queries();
        assertThat(queries).hasSize(1);
        assertThat(queries.get(0).sql()).isEqualTo(OrderRepository.OPEN_ORDERS_SQL);
    }

    @Test
    void shouldAttributeQueryToApplicationSource() {
        new OrderRepository(eventSource).findOpenOrders();

        CapturedQuery query = monitor.queries().get(0);

        assertThat(query.sourceLocation()).isNotNull();
        assertThat(query.sourceLocation().file()).isEqualTo("com/example/shop/OrderRepository.java");
        assertThat(query.sourceLocation().method()).isEqualTo("findOpenOrders");
        assertThat(query.controller()).isEqualTo("orders");
        assertThat(query.action()).isEqualTo("index");
    }
}
