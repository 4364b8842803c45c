package com.flashperp.ledger.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only ledger history, one JSONL file per UTC day under {@code <baseDir>/ledger/journal}.
 * <p>
 * Replay reads whole days in order. A line that does not parse is skipped with a warning so one
 * torn write does not hide the rest of the day.
 */
public class LedgerJournal {

    private static final Logger log = LoggerFactory.getLogger(LedgerJournal.class);

    private record DayFile(LocalDate day, BufferedWriter writer) {}

    private final Path journalDir;
    private final Clock clock;
    private final ObjectMapper mapper;

    private DayFile open;

    public LedgerJournal(Path baseDir, Clock clock) {
        this.journalDir = baseDir.resolve("ledger").resolve("journal");
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            Files.createDirectories(journalDir);
        } catch (IOException e) {
            log.error("Failed to create journal directory: {}", journalDir, e);
        }
    }

    /**
     * Append an event to the file of the current UTC day. The ledger has already committed the
     * change the event describes, so a write failure is logged and not rethrown.
     */
    public synchronized void append(LedgerEvent event) {
        try {
            BufferedWriter writer = writerFor(today());
            writer.write(mapper.writeValueAsString(event));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            log.error("Journal write failed, event lost: {} ({})", event.getSummary(), e.getMessage());
        }
    }

    public List<LedgerEvent> readToday() {
        LocalDate today = today();
        return read(today, today);
    }

    /**
     * Every event journaled on the days {@code from} through {@code to}, oldest first.
     */
    public List<LedgerEvent> read(LocalDate from, LocalDate to) {
        List<LedgerEvent> events = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            readDay(day, events);
        }
        return events;
    }

    /**
     * Lifecycle, funding and shortfall events of one position, oldest first.
     */
    public List<LedgerEvent> positionHistory(long positionId, LocalDate from, LocalDate to) {
        return read(from, to).stream()
                .filter(e -> e.concerns(positionId))
                .toList();
    }

    /**
     * Uncollected losses journaled on the days {@code from} through {@code to}.
     */
    public List<ShortfallEvent> shortfalls(LocalDate from, LocalDate to) {
        return ofType(ShortfallEvent.class, read(from, to));
    }

    public Path getJournalDir() {
        return journalDir;
    }

    public synchronized void close() {
        if (open == null) {
            return;
        }
        try {
            open.writer().close();
        } catch (IOException e) {
            log.error("Failed to close journal file for {}", open.day(), e);
        }
        open = null;
    }

    private void readDay(LocalDate day, List<LedgerEvent> into) {
        Path file = fileFor(day);
        if (!Files.exists(file)) {
            return;
        }
        try (Stream<String> lines = Files.lines(file)) {
            lines.filter(line -> !line.isBlank())
                    .forEach(line -> {
                        try {
                            into.add(mapper.readValue(line, LedgerEvent.class));
                        } catch (JsonProcessingException e) {
                            log.warn("Skipping unreadable journal line in {}: {}", file.getFileName(), e.getOriginalMessage());
                        }
                    });
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to read journal file: {}", file, e);
        }
    }

    private BufferedWriter writerFor(LocalDate day) throws IOException {
        if (open != null && open.day().equals(day)) {
            return open.writer();
        }
        close();
        BufferedWriter writer = Files.newBufferedWriter(fileFor(day),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        open = new DayFile(day, writer);
        return writer;
    }

    private Path fileFor(LocalDate day) {
        return journalDir.resolve(day + ".jsonl");
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static <T extends LedgerEvent> List<T> ofType(Class<T> type, List<LedgerEvent> events) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }
}
