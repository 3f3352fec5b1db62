package org.carball.pgsight.monitor;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySessionStateStoreTest {

    @Test
    void shouldReportActiveSessionUntilCleared() {
        InMemorySessionStateStore store = new InMemorySessionStateStore(Duration.ofHours(24));

        assertThat(store.isEnabled()).isFalse();
        assertThat(store.sessionId()).isNull();

        assertThat(store.activate("session-1")).isTrue();
        assertThat(store.isEnabled()).isTrue();
        assertThat(store.sessionId()).isEqualTo("session-1");

        assertThat(store.clear()).isTrue();
        assertThat(store.isEnabled()).isFalse();
        assertThat(store.sessionId()).isNull();
    }

    @Test
    void shouldExpireSessionAfterTtl() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        InMemorySessionStateStore store = new InMemorySessionStateStore(Duration.ofHours(24), clock);
        store.activate("session-1");

        // When
        clock.advance(Duration.ofHours(23));

        // Then
        assertThat(store.sessionId()).isEqualTo("session-1");

        clock.advance(Duration.ofHours(1));
        assertThat(store.isEnabled()).isFalse();
        assertThat(store.sessionId()).isNull();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
