package org.carball.pgsight.model.monitor;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class MonitorStatus {
    private final boolean enabled;
    private final String sessionId;
    private final int queryCount;
}
