package org.carball.pgsight.explain;

import org.carball.pgsight.model.plan.NodeType;
import org.carball.pgsight.model.plan.PlanMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlanLineClassifierTest {

    @Test
    void shouldClassifyBitmapHeapScan() {
        String line = "  ->  Bitmap Heap Scan on orders  (cost=12.50..980.20 rows=420 width=64) (actual time=0.20..3.10 rows=398 loops=1)";

        assertThat(PlanLineClassifier.classify(line)).isEqualTo(NodeType.BITMAP_HEAP_SCAN);
    }

    @Test
    void shouldReturnNullForLinesOutsideTheTaxonomy() {
        assertThat(PlanLineClassifier.classify("Planning Time: 0.12 ms")).isNull();
        assertThat(PlanLineClassifier.classify("  ->  Hash  (cost=1.00..1.00 rows=1 width=4)")).isNull();
        assertThat(PlanLineClassifier.classify(null)).isNull();
    }

    @Test
    void shouldResolveOverlappingLabelsByDeclarationOrder() {
        // "Index Scan" is declared before "Bitmap Index Scan" and is contained in it
        assertThat(PlanLineClassifier.classify("->  Bitmap Index Scan on idx_orders_status")).isEqualTo(NodeType.INDEX_SCAN);
        assertThat(PlanLineClassifier.classify("->  Gather Merge  (cost=1000.00..2000.00 rows=10 width=4)")).isEqualTo(NodeType.GATHER);
        assertThat(PlanLineClassifier.classify("HashAggregate  (cost=10.00..12.00 rows=200 width=12)")).isEqualTo(NodeType.HASH_AGGREGATE);
        assertThat(PlanLineClassifier.classify("Finalize GroupAggregate  (cost=10.00..12.00 rows=2 width=12)")).isEqualTo(NodeType.GROUP_AGGREGATE);
        assertThat(PlanLineClassifier.classify("->  Index Only Scan using users_pkey on users")).isEqualTo(NodeType.INDEX_ONLY_SCAN);
    }

    @Test
    void shouldExtractAllMetricsFromAnalyzedNode() {
        // Given
        String line = "Seq Scan on orders  (cost=0.00..15000.00 rows=50000 width=40) (actual time=0.01..250.30 rows=48000 loops=3)";

        // When
        PlanMetrics metrics = PlanLineClassifier.extractMetrics(line);

        // Then
        assertThat(metrics.getStartupCost()).isEqualTo(0.0);
        assertThat(metrics.getTotalCost()).isEqualTo(15000.0);
        assertThat(metrics.getRowsEstimated()).isEqualTo(50000L);
        assertThat(metrics.getRowsActual()).isEqualTo(48000L);
        assertThat(metrics.getActualTimeStart()).isEqualTo(0.01);
        assertThat(metrics.getActualTimeEnd()).isEqualTo(250.30);
        assertThat(metrics.getLoops()).isEqualTo(3L);
        assertThat(metrics.getBuffersHit()).isNull();
        assertThat(metrics.getBuffersRead()).isNull();
    }

    @Test
    void shouldNotReportAnEstimateForActualOnlyLines() {
        PlanMetrics metrics = PlanLineClassifier.extractMetrics("Seq Scan on tags (actual time=0.01..0.50 rows=42 loops=1)");

        assertThat(metrics.getRowsEstimated()).isNull();
        assertThat(metrics.getRowsActual()).isEqualTo(42L);
        assertThat(metrics.getTotalCost()).isNull();
    }

    @Test
    void shouldExtractBufferCounts() {
        PlanMetrics both = PlanLineClassifier.extractMetrics("        Buffers: shared hit=120 read=30");
        PlanMetrics readOnly = PlanLineClassifier.extractMetrics("        Buffers: shared read=5");

        assertThat(both.getBuffersHit()).isEqualTo(120L);
        assertThat(both.getBuffersRead()).isEqualTo(30L);
        assertThat(readOnly.getBuffersHit()).isNull();
        assertThat(readOnly.getBuffersRead()).isEqualTo(5L);
    }

    @Test
    void shouldLeaveMetricsEmptyWhenNothingMatches() {
        assertThat(PlanLineClassifier.extractMetrics("  Filter: (status = 'open'::text)").isEmpty()).isTrue();
        assertThat(PlanLineClassifier.extractMetrics(null).isEmpty()).isTrue();
    }

    @Test
    void shouldComputeIndentLevelFromLeadingSpaces() {
        assertThat(PlanLineClassifier.indentLevel("Limit  (cost=0.00..1.00 rows=1 width=4)")).isZero();
        assertThat(PlanLineClassifier.indentLevel("  ->  Sort")).isEqualTo(1);
        assertThat(PlanLineClassifier.indentLevel("        ->  Seq Scan on t")).isEqualTo(4);
    }
}
