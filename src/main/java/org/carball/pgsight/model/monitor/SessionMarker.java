package org.carball.pgsight.model.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Written to the query log at session boundaries so readers can group entries by session.
 */
@Data
@AllArgsConstructor
public class SessionMarker {

    public static final String SESSION_START = "session_start";
    public static final String SESSION_END = "session_end";

    @JsonProperty("type")
    private final String type;

    @JsonProperty("session_id")
    private final String sessionId;

    @JsonProperty("timestamp")
    private final String timestamp;
}
