package com.worklog.tracking;

import com.worklog.config.TrackingConfig;
import com.worklog.model.TimeEntry;
import com.worklog.model.WorkDay;
import com.worklog.storage.memory.InMemorySessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntryLedgerTest {

    private static final String OWNER = "alice";
    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private InMemorySessionStore store;
    private MutableClock clock;
    private TimerStateMachine timers;
    private EntryLedger ledger;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore();
        clock = new MutableClock(T0);
        OwnerLocks locks = new OwnerLocks(Duration.ofSeconds(1));
        RequestValidator validator = new RequestValidator(TrackingConfig.defaults());
        timers = new TimerStateMachine(store, clock, locks, validator);
        ledger = new EntryLedger(store, clock, locks, validator);
    }

    @Test
    void shouldAppendEntryToActiveWorkDay() throws Exception {
        WorkDay day = timers.startWorkDay(OWNER, null);
        clock.advance(Duration.ofHours(2));

        TimeEntry entry = ledger.addEntry(OWNER, EntryRequest.of("  Fix login bug ", 90)
                .withCommitHash("a1b2c3d")
                .withJiraTicket("AUTH-42")
                .withProject("portal")
                .withTags("backend", " auth ", ""));

        assertEquals(day.id(), entry.workDayId());
        assertEquals("Fix login bug", entry.description());
        assertEquals(90, entry.durationMinutes());
        assertEquals(T0.plus(Duration.ofHours(2)), entry.recordedAt());
        assertEquals(Optional.of("a1b2c3d"), entry.commitHash());
        assertEquals(Optional.of("AUTH-42"), entry.jiraTicket());
        assertEquals(Optional.of("portal"), entry.project());
        assertEquals(List.of("auth", "backend"), List.copyOf(entry.tags()));
        assertEquals(List.of(entry), store.load(OWNER).orElseThrow().entries());
    }

    @Test
    void shouldKeepEntriesInInsertionOrder() throws Exception {
        timers.startWorkDay(OWNER, null);

        TimeEntry first = ledger.addEntry(OWNER, EntryRequest.of("Write docs", 30));
        TimeEntry second = ledger.addEntry(OWNER, EntryRequest.of("Write docs", 30));

        assertEquals(List.of(first, second), store.load(OWNER).orElseThrow().entries());
    }

    @Test
    void shouldRejectOutOfRangeDurationsWithoutSaving() throws Exception {
        WorkDay day = timers.startWorkDay(OWNER, null);

        for (int minutes : new int[]{0, -5, 1441}) {
            TrackingException ex = assertThrows(TrackingException.class,
                    () -> ledger.addEntry(OWNER, EntryRequest.of("Invalid", minutes)));
            assertEquals(ErrorKind.VALIDATION, ex.kind());
        }
        assertEquals(day, store.load(OWNER).orElseThrow());
    }

    @Test
    void shouldRejectOversizedOptionalFields() throws Exception {
        timers.startWorkDay(OWNER, null);

        TrackingException hash = assertThrows(TrackingException.class,
                () -> ledger.addEntry(OWNER, EntryRequest.of("Refactor", 20).withCommitHash("f".repeat(41))));
        TrackingException blank = assertThrows(TrackingException.class,
                () -> ledger.addEntry(OWNER, EntryRequest.of(" ", 20)));

        assertEquals(ErrorKind.VALIDATION, hash.kind());
        assertEquals(ErrorKind.VALIDATION, blank.kind());
        assertTrue(store.load(OWNER).orElseThrow().entries().isEmpty());
    }

    @Test
    void shouldFailWithoutActiveWorkDay() throws Exception {
        TrackingException none = assertThrows(TrackingException.class,
                () -> ledger.addEntry(OWNER, EntryRequest.of("Orphan", 10)));
        assertEquals(ErrorKind.NOT_FOUND, none.kind());

        timers.startWorkDay(OWNER, null);
        timers.stopWorkDay(OWNER);
        TrackingException ended = assertThrows(TrackingException.class,
                () -> ledger.addEntry(OWNER, EntryRequest.of("Late", 10)));
        assertEquals(ErrorKind.NOT_FOUND, ended.kind());
    }

    @Test
    void shouldBackfillEndedWorkDayById() throws Exception {
        WorkDay yesterday = timers.startWorkDay(OWNER, null);
        timers.stopWorkDay(OWNER);
        clock.advance(Duration.ofDays(1));
        WorkDay today = timers.startWorkDay(OWNER, null);

        TimeEntry entry = ledger.addEntry(OWNER, EntryRequest.of("Forgot to log", 45).forWorkDay(yesterday.id()));

        assertEquals(yesterday.id(), entry.workDayId());
        assertEquals(1, store.loadById(OWNER, yesterday.id()).orElseThrow().entries().size());
        assertTrue(store.loadById(OWNER, today.id()).orElseThrow().entries().isEmpty());
        assertEquals(today.id(), store.load(OWNER).orElseThrow().id());
    }

    @Test
    void shouldNotBackfillUnknownOrForeignWorkDay() throws Exception {
        WorkDay bobs = timers.startWorkDay("bob", null);
        timers.startWorkDay(OWNER, null);

        TrackingException unknown = assertThrows(TrackingException.class,
                () -> ledger.addEntry(OWNER, EntryRequest.of("Nowhere", 5).forWorkDay(UUID.randomUUID())));
        TrackingException foreign = assertThrows(TrackingException.class,
                () -> ledger.addEntry(OWNER, EntryRequest.of("Not mine", 5).forWorkDay(bobs.id())));

        assertEquals(ErrorKind.NOT_FOUND, unknown.kind());
        assertEquals(ErrorKind.NOT_FOUND, foreign.kind());
        assertTrue(store.load("bob").orElseThrow().entries().isEmpty());
    }
}
