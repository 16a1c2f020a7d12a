package com.wickscan.execution.journal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Append-only JSONL daily trade log.
 * Files: ~/.wickscan/trades/2026-02-08.jsonl
 *
 * Events already present in any file are indexed at startup so replays after a restart stay
 * idempotent.
 */
public class JsonlTradeLog implements TradeLogStore {

    private static final Logger log = LoggerFactory.getLogger(JsonlTradeLog.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path dir;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Set<String> recorded = ConcurrentHashMap.newKeySet();

    private LocalDate currentDate;
    private BufferedWriter currentWriter;

    public JsonlTradeLog(Path dir, Clock clock) {
        this.dir = dir;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create trade log directory: {}", dir, e);
        }
        indexExisting();
    }

    @Override
    public void recordOpen(TradeOpenEvent event) {
        append(event);
    }

    @Override
    public void recordUpdate(TradeUpdateEvent event) {
        append(event);
    }

    @Override
    public void recordClose(TradeCloseEvent event) {
        append(event);
    }

    /**
     * Whether an event with the same signal id and key was already written.
     */
    public boolean contains(TradeEvent event) {
        return recorded.contains(event.dedupKey());
    }

    private synchronized void append(TradeEvent event) {
        String key = event.dedupKey();
        if (recorded.contains(key)) {
            log.debug("Skipping duplicate trade event {}", key);
            return;
        }
        try {
            ensureWriter();
            currentWriter.write(mapper.writeValueAsString(event));
            currentWriter.newLine();
            currentWriter.flush();
            recorded.add(key);
        } catch (IOException e) {
            log.error("Failed to write trade event {}: {}", key, e.getMessage());
        }
    }

    /**
     * Read entries of one day.
     */
    public List<TradeEvent> readDate(LocalDate date) {
        return readFile(dir.resolve(date.format(DATE_FORMAT) + ".jsonl"));
    }

    public List<TradeEvent> readAll() {
        List<TradeEvent> events = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return events;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(f -> f.getFileName().toString().endsWith(".jsonl"))
                .sorted()
                .forEach(f -> events.addAll(readFile(f)));
        } catch (IOException e) {
            log.error("Failed to list trade log directory: {}", dir, e);
        }
        return events;
    }

    public synchronized void close() {
        if (currentWriter != null) {
            try {
                currentWriter.close();
            } catch (IOException e) {
                log.error("Failed to close trade log writer", e);
            }
            currentWriter = null;
            currentDate = null;
        }
    }

    private List<TradeEvent> readFile(Path file) {
        List<TradeEvent> events = new ArrayList<>();
        if (!Files.exists(file)) {
            return events;
        }
        try {
            for (String line : Files.readAllLines(file)) {
                if (!line.isBlank()) {
                    events.add(mapper.readValue(line, TradeEvent.class));
                }
            }
        } catch (IOException e) {
            log.error("Failed to read trade log file: {}", file, e);
        }
        return events;
    }

    private void indexExisting() {
        List<TradeEvent> existing = readAll();
        existing.forEach(e -> recorded.add(e.dedupKey()));
        if (!existing.isEmpty()) {
            log.info("Indexed {} existing trade events", existing.size());
        }
    }

    private void ensureWriter() throws IOException {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(currentDate)) {
            if (currentWriter != null) {
                currentWriter.close();
            }
            Path file = dir.resolve(today.format(DATE_FORMAT) + ".jsonl");
            currentWriter = Files.newBufferedWriter(file,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            currentDate = today;
        }
    }
}
