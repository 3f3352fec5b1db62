package org.carball.pgsight.model.monitor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import org.carball.pgsight.annotation.AnnotationParser;

import java.util.Map;

/**
 * A query accepted by the monitor during a session. One JSON line in the query log.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CapturedQuery(
        @JsonProperty("type") String type,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("sql") String sql,
        @JsonProperty("duration_ms") double durationMs,
        @JsonProperty("name") String name,
        @JsonProperty("source_location") SourceLocation sourceLocation,
        @JsonProperty("controller") String controller,
        @JsonProperty("action") String action,
        @JsonProperty("timestamp") String timestamp
) {

    public static final String TYPE = "query";

    /**
     * Provenance comment embedded in the SQL text, if any.
     */
    @JsonIgnore
    public Map<String, String> annotation() {
        return AnnotationParser.parse(sql);
    }

    @JsonIgnore
    public String displaySql() {
        return AnnotationParser.stripAnnotations(sql);
    }
}
