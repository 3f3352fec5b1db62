package org.carball.pgsight.model.monitor;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a session lifecycle call. Failures are values, never exceptions.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MonitorResult {

    private final boolean success;
    private final String message;
    private final String sessionId;
    private final MonitorErrorKind error;

    public static MonitorResult success(String message, String sessionId) {
        return new MonitorResult(true, message, sessionId, null);
    }

    public static MonitorResult failure(MonitorErrorKind error, String message) {
        return new MonitorResult(false, message, null, error);
    }
}
