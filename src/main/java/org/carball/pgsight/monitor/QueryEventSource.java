package org.carball.pgsight.monitor;

/**
 * Named notification channels of the host's data-access layer.
 */
public interface QueryEventSource {

    /**
     * Registers a listener on a channel.
     *
     * @throws RuntimeException when the event system refuses the subscription
     */
    Subscription subscribe(String channel, QueryEventListener listener);

    /**
     * Handle returned by {@link #subscribe}; cancelling it stops further deliveries.
     */
    interface Subscription {

        void unsubscribe();
    }
}
