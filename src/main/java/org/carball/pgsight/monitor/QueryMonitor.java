package org.carball.pgsight.monitor;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgsight.annotation.RequestContext;
import org.carball.pgsight.caller.CallerLocator;
import org.carball.pgsight.caller.StackFrameFilter;
import org.carball.pgsight.config.MonitorConfig;
import org.carball.pgsight.model.monitor.CapturedQuery;
import org.carball.pgsight.model.monitor.MonitorErrorKind;
import org.carball.pgsight.model.monitor.MonitorResult;
import org.carball.pgsight.model.monitor.MonitorStatus;
import org.carball.pgsight.model.monitor.SessionMarker;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Captures the queries an application executes while a monitoring session is active.
 *
 * <p>{@link #start()} and {@link #stop()} run under one lifecycle lock so the enabled flag,
 * session id and buffer always change together. Session state changes and their log markers
 * also take the buffer lock, so in the query log every entry sits between its session's markers. The capture callback only takes the buffer
 * lock and never touches the filesystem; accepted queries are mirrored to the query log by
 * its background writer.
 */
@Slf4j
public class QueryMonitor implements AutoCloseable {

    public static final String CHANNEL = "sql.query";

    private final MonitorConfig config;
    private final QueryEventSource eventSource;
    private final SessionStateStore stateStore;
    private final QueryLog queryLog;
    private final CallerLocator callerLocator;
    private final ExclusionPolicy exclusionPolicy;
    private final Clock clock;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Object bufferLock = new Object();
    private final Deque<CapturedQuery> buffer = new ArrayDeque<>();
    private volatile int bufferCount;
    private volatile QueryEventSource.Subscription subscription;

    public QueryMonitor(MonitorConfig config, QueryEventSource eventSource) {
        this(config, eventSource, new InMemorySessionStateStore(config.getSessionTtl()));
    }

    public QueryMonitor(MonitorConfig config, QueryEventSource eventSource, SessionStateStore stateStore) {
        this(config, eventSource, stateStore,
                new QueryLog(config.getLogFile(), config.getLogQueueCapacity()),
                new CallerLocator(config.getCallerFramesToSkip(), config.getCallerFrameLimit(),
                        StackFrameFilter.applicationFrames(config.getFrameworkPatterns())),
                ExclusionPolicy.fromConfig(config),
                Clock.systemUTC());
    }

    public QueryMonitor(MonitorConfig config,
                        QueryEventSource eventSource,
                        SessionStateStore stateStore,
                        QueryLog queryLog,
                        CallerLocator callerLocator,
                        ExclusionPolicy exclusionPolicy,
                        Clock clock) {
        this.config = config;
        this.eventSource = eventSource;
        this.stateStore = stateStore;
        this.queryLog = queryLog;
        this.callerLocator = callerLocator;
        this.exclusionPolicy = exclusionPolicy;
        this.clock = clock;

        // Another process may have started the session already
        ensureSubscriptionIfEnabled();
    }

    public MonitorResult start() {
        lifecycleLock.lock();
        try {
            if (isEnabled()) {
                log.info("Monitoring already active, session_id={}", sessionId());
                return MonitorResult.failure(MonitorErrorKind.ALREADY_ACTIVE, "Monitoring already active");
            }

            String newSessionId = UUID.randomUUID().toString();
            clearBuffer();

            // Subscribed first: events delivered before the session becomes visible see it disabled
            try {
                ensureSubscription();
            } catch (RuntimeException e) {
                log.warn("Failed to subscribe to {}: {}", CHANNEL, e.getMessage());
                return MonitorResult.failure(MonitorErrorKind.SUBSCRIPTION_FAILURE,
                        "Failed to subscribe to query events: " + e.getMessage());
            }

            // The start marker is queued before any entry of the new session can be
            synchronized (bufferLock) {
                if (!writeState(newSessionId)) {
                    unsubscribeQuietly();
                    return MonitorResult.failure(MonitorErrorKind.STATE_STORE_FAILURE,
                            "Failed to record monitoring session state");
                }
                queryLog.appendMarker(new SessionMarker(SessionMarker.SESSION_START, newSessionId, timestamp()));
            }

            log.info("Monitoring started, session_id={}", newSessionId);
            return MonitorResult.success("Query monitoring started", newSessionId);
        } finally {
            lifecycleLock.unlock();
        }
    }

    public MonitorResult stop() {
        lifecycleLock.lock();
        try {
            if (!isEnabled()) {
                return MonitorResult.failure(MonitorErrorKind.NOT_ACTIVE, "Monitoring not active");
            }

            String currentSessionId = sessionId();

            try {
                removeSubscription();
            } catch (RuntimeException e) {
                log.warn("Failed to unsubscribe from {}: {}", CHANNEL, e.getMessage());
                return MonitorResult.failure(MonitorErrorKind.SUBSCRIPTION_FAILURE,
                        "Failed to unsubscribe from query events: " + e.getMessage());
            }

            // From here on late callbacks see no session and drop their events; the end marker
            // follows every entry already accepted for the session
            synchronized (bufferLock) {
                clearState();
                queryLog.appendMarker(new SessionMarker(SessionMarker.SESSION_END, currentSessionId, timestamp()));
            }
            queryLog.flush(Duration.ofMillis(config.getFlushTimeoutMs()));

            clearBuffer();

            log.info("Monitoring stopped, session_id={}", currentSessionId);
            return MonitorResult.success("Query monitoring stopped", currentSessionId);
        } finally {
            lifecycleLock.unlock();
        }
    }

    public MonitorStatus status() {
        return new MonitorStatus(isEnabled(), sessionId(), bufferCount);
    }

    public boolean isEnabled() {
        try {
            return stateStore.isEnabled();
        } catch (RuntimeException e) {
            log.warn("Session state read failed: {}", e.getMessage());
            return false;
        }
    }

    public String sessionId() {
        try {
            return stateStore.sessionId();
        } catch (RuntimeException e) {
            log.warn("Session state read failed: {}", e.getMessage());
            return null;
        }
    }

    public List<CapturedQuery> queries() {
        return queries(null, null);
    }

    /**
     * Returns a copy of the buffered queries.
     *
     * @param limit     keep only the most recent entries, or all when null or negative
     * @param sessionId only entries of this session, or all when null
     */
    public List<CapturedQuery> queries(Integer limit, String sessionId) {
        List<CapturedQuery> snapshot;
        synchronized (bufferLock) {
            snapshot = new ArrayList<>(buffer);
        }

        if (sessionId != null) {
            snapshot = snapshot.stream()
                    .filter(q -> sessionId.equals(q.sessionId()))
                    .collect(Collectors.toList());
        }

        return QueryLog.lastN(snapshot, limit);
    }

    /**
     * Reads captured queries back from the query log. Never fails; returns an empty list
     * when file logging is disabled.
     */
    public List<CapturedQuery> loadFromLog(Integer limit, String sessionId) {
        return queryLog.load(sessionId, limit);
    }

    /**
     * Detaches this process from the event source and closes the query log. The shared
     * session state is left untouched.
     */
    @Override
    public void close() {
        lifecycleLock.lock();
        try {
            unsubscribeQuietly();
            queryLog.flush(Duration.ofMillis(config.getFlushTimeoutMs()));
            queryLog.close();
        } finally {
            lifecycleLock.unlock();
        }
    }

    void handleEvent(QueryEvent event) {
        try {
            if (!isEnabled()) {
                return;
            }

            ExclusionPolicy.SkipReason reason = exclusionPolicy.skipReason(event);
            if (reason != null) {
                log.trace("Skipping query ({}): {}", reason, event.name());
                return;
            }

            String currentSessionId = sessionId();
            if (currentSessionId == null) {
                return;
            }

            RequestContext context = event.context() != null ? event.context() : RequestContext.none();
            CapturedQuery entry = CapturedQuery.builder()
                    .type(CapturedQuery.TYPE)
                    .sessionId(currentSessionId)
                    .sql(event.sql())
                    .durationMs(event.durationMs())
                    .name(event.name())
                    .sourceLocation(callerLocator.locate())
                    .controller(context.controller())
                    .action(context.action())
                    .timestamp(timestamp())
                    .build();

            addToBuffer(entry);
        } catch (RuntimeException e) {
            // Never break query execution in the host
            log.warn("Failed to capture query: {}", e.getMessage());
        }
    }

    private void addToBuffer(CapturedQuery entry) {
        synchronized (bufferLock) {
            // The session may have ended or changed while the entry was being built
            if (!entry.sessionId().equals(sessionId())) {
                return;
            }

            buffer.addLast(entry);
            while (buffer.size() > Math.max(0, config.getMaxQueries())) {
                buffer.removeFirst();
            }
            bufferCount = buffer.size();

            queryLog.appendQuery(entry);
        }
    }

    private void clearBuffer() {
        synchronized (bufferLock) {
            buffer.clear();
            bufferCount = 0;
        }
    }

    private void ensureSubscriptionIfEnabled() {
        if (!isEnabled()) {
            return;
        }
        try {
            ensureSubscription();
        } catch (RuntimeException e) {
            log.warn("Failed to subscribe to {} for active session: {}", CHANNEL, e.getMessage());
        }
    }

    private void ensureSubscription() {
        if (subscription != null) {
            return;
        }
        subscription = eventSource.subscribe(CHANNEL, this::handleEvent);
        log.debug("Subscribed to {}", CHANNEL);
    }

    private void removeSubscription() {
        if (subscription == null) {
            return;
        }
        subscription.unsubscribe();
        subscription = null;
        log.debug("Unsubscribed from {}", CHANNEL);
    }

    private void unsubscribeQuietly() {
        try {
            removeSubscription();
        } catch (RuntimeException e) {
            log.warn("Failed to unsubscribe from {}: {}", CHANNEL, e.getMessage());
        }
    }

    private boolean writeState(String sessionId) {
        try {
            if (stateStore.activate(sessionId)) {
                return true;
            }
            log.warn("Session state store did not record session {}", sessionId);
        } catch (RuntimeException e) {
            log.warn("Session state write failed: {}", e.getMessage());
        }
        return false;
    }

    private void clearState() {
        try {
            if (!stateStore.clear()) {
                log.warn("Session state store did not clear the session");
            }
        } catch (RuntimeException e) {
            log.warn("Session state clear failed: {}", e.getMessage());
        }
    }

    private String timestamp() {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
                OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS));
    }
}
