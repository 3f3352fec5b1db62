package org.carball.pgsight.monitor;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process event bus. Hosts publish a {@link QueryEvent} after each statement
 * completes; listeners run on the publishing thread.
 */
@Slf4j
public class InMemoryQueryEventSource implements QueryEventSource {

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(String channel, QueryEventListener listener) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(listener, "listener");

        Registration registration = new Registration(channel, listener);
        registrations.add(registration);
        log.debug("Listener subscribed to {}", channel);
        return () -> {
            registrations.remove(registration);
            log.debug("Listener unsubscribed from {}", channel);
        };
    }

    public void publish(String channel, QueryEvent event) {
        for (Registration registration : registrations) {
            if (registration.channel().equals(channel)) {
                registration.listener().onQuery(event);
            }
        }
    }

    public int listenerCount(String channel) {
        return (int) registrations.stream()
                .filter(r -> r.channel().equals(channel))
                .count();
    }

    private record Registration(String channel, QueryEventListener listener) {}
}
