package org.carball.pgsight.monitor;

/**
 * Holds the enabled flag and session id of the monitoring session. Processes that must share
 * one logical session plug in a store backed by a shared cache; the buffer stays per process.
 */
public interface SessionStateStore {

    boolean isEnabled();

    /**
     * @return the active session id, or null when monitoring is disabled
     */
    String sessionId();

    /**
     * Marks the given session as active.
     *
     * @return false when the store could not record the state
     */
    boolean activate(String sessionId);

    /**
     * Clears the active session.
     *
     * @return false when the store could not record the state
     */
    boolean clear();
}
