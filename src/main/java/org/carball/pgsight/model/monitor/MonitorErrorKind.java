package org.carball.pgsight.model.monitor;

public enum MonitorErrorKind {
    ALREADY_ACTIVE,
    NOT_ACTIVE,
    SUBSCRIPTION_FAILURE,
    STATE_STORE_FAILURE
}
