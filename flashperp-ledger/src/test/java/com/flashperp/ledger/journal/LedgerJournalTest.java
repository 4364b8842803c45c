package com.flashperp.ledger.journal;

import com.flashperp.core.model.FundingSettlement;
import com.flashperp.core.model.Position;
import com.flashperp.core.model.Side;
import com.flashperp.ledger.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LedgerJournal persistence and readback.
 */
class LedgerJournalTest {

    private static final Instant START = Instant.parse("2026-03-01T23:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private LedgerJournal journal;
    private Position position;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        journal = new LedgerJournal(tempDir, clock);
        position = new Position(7, "alice", "ETH-PERP", Side.SHORT, 100_000L, 200_000L, 300_000L, 5, START);
    }

    @AfterEach
    void tearDown() {
        journal.close();
    }

    @Test
    @DisplayName("Events read back with their concrete types")
    void roundTripsTypes() {
        journal.append(PositionEvent.opened(position, 15L, START));
        journal.append(FundingEvent.settled(position,
            new FundingSettlement(7, 1, 100, -2_000L, -2_000L, 0, START)));
        journal.append(new ShortfallEvent(ShortfallEvent.Source.LIQUIDATION, 7, "alice", "ETH-PERP", 42L, START));

        List<LedgerEvent> events = journal.readToday();

        assertEquals(3, events.size());
        PositionEvent opened = assertInstanceOf(PositionEvent.class, events.get(0));
        assertEquals("opened", opened.getAction());
        assertEquals(Side.SHORT, opened.getSide());
        assertEquals(15L, opened.getFee());
        assertEquals(START, opened.getTimestamp());

        FundingEvent funding = assertInstanceOf(FundingEvent.class, events.get(1));
        assertEquals(-2_000L, funding.getApplied());
        assertEquals(7L, funding.getPositionId());

        ShortfallEvent shortfall = assertInstanceOf(ShortfallEvent.class, events.get(2));
        assertEquals(ShortfallEvent.Source.LIQUIDATION, shortfall.getSource());
        assertEquals(42L, shortfall.getAmount());
    }

    @Test
    @DisplayName("Files roll over at the UTC day boundary")
    void dailyFiles() {
        journal.append(PositionEvent.opened(position, 0, START));
        clock.advance(Duration.ofHours(2));
        journal.append(PositionEvent.liquidated(position, 400_000L, -200_000L, 0, 0, "liq", clock.instant()));

        assertEquals(1, journal.read(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 1)).size());
        assertEquals(1, journal.read(LocalDate.of(2026, 3, 2), LocalDate.of(2026, 3, 2)).size());
        assertTrue(Files.exists(journal.getJournalDir().resolve("2026-03-02.jsonl")));
        assertTrue(journal.read(LocalDate.of(2026, 3, 3), LocalDate.of(2026, 3, 3)).isEmpty());
    }

    @Test
    @DisplayName("Position history spans days and keeps only that position's events")
    void positionHistory() {
        Position other = new Position(8, "bob", "ETH-PERP", Side.LONG, 100_000L, 200_000L, 300_000L, 5, START);
        journal.append(PositionEvent.opened(position, 0, START));
        journal.append(PositionEvent.opened(other, 0, START));
        clock.advance(Duration.ofHours(2));
        journal.append(FundingEvent.rateUpdated("ETH-PERP", 0, 100, 303_000L, 300_000L, clock.instant()));
        journal.append(PositionEvent.liquidated(position, 400_000L, -200_000L, 0, 0, "liq", clock.instant()));
        journal.append(new ShortfallEvent(ShortfallEvent.Source.LIQUIDATION, 7, "alice", "ETH-PERP", 42L,
            clock.instant()));

        List<LedgerEvent> history = journal.positionHistory(7, LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 2));

        assertEquals(3, history.size());
        assertEquals("opened", ((PositionEvent) history.get(0)).getAction());
        assertEquals("liquidated", ((PositionEvent) history.get(1)).getAction());
        assertInstanceOf(ShortfallEvent.class, history.get(2));
        assertEquals(2, journal.positionHistory(7, LocalDate.of(2026, 3, 2), LocalDate.of(2026, 3, 2)).size());
    }

    @Test
    @DisplayName("Shortfalls are read back for a range of days")
    void shortfallsInRange() {
        journal.append(new ShortfallEvent(ShortfallEvent.Source.CLOSE, 7, "alice", "ETH-PERP", 10L, START));
        journal.append(PositionEvent.opened(position, 0, START));
        clock.advance(Duration.ofDays(1));
        journal.append(new ShortfallEvent(ShortfallEvent.Source.FUNDING, 7, "alice", "ETH-PERP", 5L,
            clock.instant()));

        List<ShortfallEvent> both = journal.shortfalls(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 2));
        assertEquals(2, both.size());
        assertEquals(ShortfallEvent.Source.CLOSE, both.get(0).getSource());
        assertEquals(ShortfallEvent.Source.FUNDING, both.get(1).getSource());

        assertEquals(1, journal.shortfalls(LocalDate.of(2026, 3, 2), LocalDate.of(2026, 3, 2)).size());
    }

    @Test
    @DisplayName("Unreadable line is skipped, the rest of the day still reads")
    void skipsUnreadableLine() throws Exception {
        journal.append(PositionEvent.opened(position, 0, START));
        journal.close();
        Files.writeString(journal.getJournalDir().resolve("2026-03-01.jsonl"), "{\"eventType\":\"pos\n",
            StandardOpenOption.APPEND);
        journal.append(new ShortfallEvent(ShortfallEvent.Source.CLOSE, 7, "alice", "ETH-PERP", 10L, START));

        List<LedgerEvent> events = journal.readToday();

        assertEquals(2, events.size());
        assertInstanceOf(PositionEvent.class, events.get(0));
        assertInstanceOf(ShortfallEvent.class, events.get(1));
    }

    @Test
    @DisplayName("Summary describes the event")
    void summary() {
        PositionEvent event = PositionEvent.reduced(position, 100_000L, 290_000L, 10L, 50_010L, false, START);
        assertTrue(event.getSummary().startsWith("[decreased] #7 alice ETH-PERP SHORT"));
        assertEquals("position", event.getEventType());
    }
}
