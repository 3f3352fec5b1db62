package org.carball.pgsight.monitor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local session state with an expiry, so a session nobody stops does not stay
 * enabled forever.
 */
public class InMemorySessionStateStore implements SessionStateStore {

    private final AtomicReference<ActiveSession> state = new AtomicReference<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemorySessionStateStore(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public InMemorySessionStateStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public boolean isEnabled() {
        return current() != null;
    }

    @Override
    public String sessionId() {
        ActiveSession session = current();
        return session != null ? session.sessionId() : null;
    }

    @Override
    public boolean activate(String sessionId) {
        state.set(new ActiveSession(sessionId, clock.instant().plus(ttl)));
        return true;
    }

    @Override
    public boolean clear() {
        state.set(null);
        return true;
    }

    private ActiveSession current() {
        ActiveSession session = state.get();
        if (session != null && !clock.instant().isBefore(session.expiresAt())) {
            state.compareAndSet(session, null);
            return null;
        }
        return session;
    }

    private record ActiveSession(String sessionId, Instant expiresAt) {}
}
