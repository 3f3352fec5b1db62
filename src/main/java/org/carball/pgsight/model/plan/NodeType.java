package org.carball.pgsight.model.plan;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Plan node taxonomy. Declaration order is the classification order and the only tie-break:
 * the first label contained in a line wins. Some labels contain earlier ones ("Bitmap Index Scan"
 * contains "Index Scan", "Gather Merge" contains "Gather") and therefore never match on their own;
 * reordering changes how existing plans are classified.
 */
@Getter
public enum NodeType {
    SEQ_SCAN("Seq Scan", "warning", "Full table scan - potentially slow for large tables"),
    INDEX_SCAN("Index Scan", "good", "Using an index efficiently"),
    INDEX_ONLY_SCAN("Index Only Scan", "good", "Most efficient - reading only from index"),
    BITMAP_INDEX_SCAN("Bitmap Index Scan", "ok", "First step of bitmap scan"),
    BITMAP_HEAP_SCAN("Bitmap Heap Scan", "ok", "Using multiple indexes combined"),
    NESTED_LOOP("Nested Loop", "neutral", "Joining tables in a loop"),
    HASH_JOIN("Hash Join", "good", "Efficient join using hash table"),
    MERGE_JOIN("Merge Join", "good", "Efficient join on sorted data"),
    SORT("Sort", "warning", "Sorting data in memory or disk"),
    HASH_AGGREGATE("HashAggregate", "ok", "Grouping using hash table"),
    GROUP_AGGREGATE("GroupAggregate", "ok", "Grouping on sorted data"),
    AGGREGATE("Aggregate", "ok", "Computing aggregate functions"),
    LIMIT("Limit", "good", "Limiting result set"),
    SUBQUERY_SCAN("Subquery Scan", "neutral", "Scanning a subquery result"),
    CTE_SCAN("CTE Scan", "neutral", "Scanning a Common Table Expression"),
    MATERIALIZE("Materialize", "warning", "Caching intermediate results"),
    GATHER("Gather", "ok", "Parallel query coordination"),
    GATHER_MERGE("Gather Merge", "ok", "Parallel query with merge");

    private final String label;
    private final String color;
    private final String description;

    NodeType(String label, String color, String description) {
        this.label = label;
        this.color = color;
        this.description = description;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public NodeInfo info() {
        return new NodeInfo(color, description);
    }
}
