package org.carball.pgsight.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgsight.model.monitor.CapturedQuery;
import org.carball.pgsight.model.monitor.SessionMarker;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Append-only newline-delimited JSON log of captured queries and session markers.
 *
 * <p>Writes are queued to a single background thread so callers never wait on the filesystem.
 * Every write or read failure is logged and contained here.
 */
@Slf4j
public class QueryLog implements AutoCloseable {

    private final Path logFile;
    private final ObjectMapper objectMapper;
    private final ThreadPoolExecutor writer;

    public QueryLog(Path logFile, int queueCapacity) {
        this.logFile = logFile;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.writer = logFile == null ? null : new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                runnable -> {
                    Thread thread = new Thread(runnable, "pgsight-query-log");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * A log that writes nothing and reads nothing.
     */
    public static QueryLog disabled() {
        return new QueryLog(null, 1);
    }

    public boolean isEnabled() {
        return logFile != null;
    }

    public Path getLogFile() {
        return logFile;
    }

    public void appendQuery(CapturedQuery query) {
        enqueue(query);
    }

    public void appendMarker(SessionMarker marker) {
        enqueue(marker);
    }

    /**
     * Waits until every entry queued so far has been written, or the timeout elapses.
     *
     * @return true when all pending writes completed
     */
    public boolean flush(Duration timeout) {
        if (!isEnabled()) {
            return true;
        }

        Future<?> barrier;
        try {
            barrier = writer.submit(() -> { });
        } catch (RejectedExecutionException e) {
            log.warn("Failed to flush query log {}: {}", logFile, e.getMessage());
            return false;
        }

        try {
            barrier.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Timed out after {} ms waiting for query log {} to flush", timeout.toMillis(), logFile);
            return false;
        } catch (ExecutionException e) {
            log.warn("Failed to flush query log {}: {}", logFile, e.getCause().getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while flushing query log {}", logFile);
            return false;
        }
    }

    /**
     * Reads captured queries back from the log.
     *
     * @param sessionId only entries of this session, or all when null
     * @param limit     keep only the most recent entries, or all when null or negative
     * @return the queries in file order; empty when logging is disabled or the file is missing
     */
    public List<CapturedQuery> load(String sessionId, Integer limit) {
        if (!isEnabled() || !Files.exists(logFile)) {
            return Collections.emptyList();
        }

        List<CapturedQuery> queries = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                CapturedQuery query = parseQuery(line.strip());
                if (query == null) {
                    continue;
                }
                if (sessionId != null && !sessionId.equals(query.sessionId())) {
                    continue;
                }
                queries.add(query);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load queries from log {}: {}", logFile, e.getMessage());
        }

        return lastN(queries, limit);
    }

    @Override
    public void close() {
        if (writer != null) {
            writer.shutdown();
        }
    }

    static <T> List<T> lastN(List<T> entries, Integer limit) {
        if (limit == null || limit < 0 || limit >= entries.size()) {
            return entries;
        }
        return new ArrayList<>(entries.subList(entries.size() - limit, entries.size()));
    }

    private CapturedQuery parseQuery(String line) {
        if (line.isEmpty()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(line);
            if (node == null || !CapturedQuery.TYPE.equals(node.path("type").asText(null))) {
                return null;
            }
            return objectMapper.treeToValue(node, CapturedQuery.class);
        } catch (JsonProcessingException e) {
            // Malformed line
            return null;
        }
    }

    private void enqueue(Object entry) {
        if (!isEnabled()) {
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize query log entry: {}", e.getMessage());
            return;
        }

        try {
            writer.execute(() -> writeLine(json));
        } catch (RejectedExecutionException e) {
            log.warn("Query log {} is full or closed, dropping entry", logFile);
        }
    }

    private void writeLine(String json) {
        try (BufferedWriter out = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            out.write(json);
            out.newLine();
        } catch (IOException e) {
            log.warn("Failed to write to query log {}: {}", logFile, e.getMessage());
        }
    }
}
