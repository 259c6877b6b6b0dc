package com.worklog.storage.sqlite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worklog.config.SqliteStorageConfig;
import com.worklog.model.Meeting;
import com.worklog.model.MeetingStatus;
import com.worklog.model.MeetingType;
import com.worklog.model.TimeEntry;
import com.worklog.model.WorkDay;
import com.worklog.model.WorkDayStatus;
import com.worklog.storage.SessionStore;
import com.worklog.storage.StorageException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public class SqliteSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteSessionStore.class);

    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {
    };

    private static final String WORK_DAY_COLUMNS =
            "id, owner_id, status, started_at, ended_at, initial_activity, current_activity";

    private final Path databasePath;
    private final Connection connection;
    private final ObjectMapper mapper = new ObjectMapper();

    public SqliteSessionStore(SqliteStorageConfig config) throws StorageException {
        Objects.requireNonNull(config, "config");
        try {
            this.databasePath = Path.of(config.databasePath()).toAbsolutePath();
            if (databasePath.getParent() != null) {
                Files.createDirectories(databasePath.getParent());
            }
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath);
            configurePragma(connection, config.journalMode(), config.busyTimeoutMillis());
            this.connection.setAutoCommit(false);
            createSchema(connection);
            this.connection.commit();
        } catch (Exception ex) {
            throw new StorageException("Failed to initialise SQLite storage", ex);
        }
        log.debug("Opened SQLite session store at {}", databasePath);
    }

    @Override
    public synchronized Optional<WorkDay> load(String ownerId) throws StorageException {
        Objects.requireNonNull(ownerId, "ownerId");
        String sql = "SELECT " + WORK_DAY_COLUMNS + " FROM work_days WHERE owner_id = ? ORDER BY seq DESC LIMIT 1";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, ownerId);
            List<WorkDay> days = readWorkDays(statement);
            return days.stream().findFirst();
        } catch (SQLException ex) {
            throw new StorageException("Failed to load work day for " + ownerId, ex);
        } finally {
            endRead();
        }
    }

    @Override
    public synchronized Optional<WorkDay> loadById(String ownerId, UUID workDayId) throws StorageException {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(workDayId, "workDayId");
        String sql = "SELECT " + WORK_DAY_COLUMNS + " FROM work_days WHERE owner_id = ? AND id = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, ownerId);
            statement.setString(2, workDayId.toString());
            return readWorkDays(statement).stream().findFirst();
        } catch (SQLException ex) {
            throw new StorageException("Failed to load work day " + workDayId, ex);
        } finally {
            endRead();
        }
    }

    @Override
    public synchronized List<WorkDay> history(String ownerId) throws StorageException {
        Objects.requireNonNull(ownerId, "ownerId");
        String sql = "SELECT " + WORK_DAY_COLUMNS + " FROM work_days WHERE owner_id = ? ORDER BY seq";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, ownerId);
            return readWorkDays(statement);
        } catch (SQLException ex) {
            throw new StorageException("Failed to load work day history for " + ownerId, ex);
        } finally {
            endRead();
        }
    }

    @Override
    public synchronized void save(WorkDay workDay) throws StorageException {
        Objects.requireNonNull(workDay, "workDay");
        try {
            upsertWorkDay(workDay);
            for (int i = 0; i < workDay.meetings().size(); i++) {
                upsertMeeting(workDay.meetings().get(i), i);
            }
            for (int i = 0; i < workDay.entries().size(); i++) {
                insertEntry(workDay.entries().get(i), i);
            }
            connection.commit();
        } catch (SQLException | JsonProcessingException ex) {
            try {
                connection.rollback();
            } catch (SQLException rollbackEx) {
                log.warn("SQLite rollback failed", rollbackEx);
            }
            throw new StorageException("Failed to save work day " + workDay.id(), ex);
        }
    }

    @Override
    public synchronized void close() throws StorageException {
        try {
            connection.close();
        } catch (SQLException ex) {
            throw new StorageException("Failed to close SQLite connection", ex);
        }
    }

    private void upsertWorkDay(WorkDay day) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO work_days
                    (id, owner_id, status, started_at, ended_at, initial_activity, current_activity)
                VALUES
                    (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    status=excluded.status,
                    started_at=excluded.started_at,
                    ended_at=excluded.ended_at,
                    current_activity=excluded.current_activity,
                    updated_at=CURRENT_TIMESTAMP
                """)) {
            statement.setString(1, day.id().toString());
            statement.setString(2, day.ownerId());
            statement.setString(3, day.status().name());
            setOptional(statement, 4, day.startedAt().map(Instant::toString));
            setOptional(statement, 5, day.endedAt().map(Instant::toString));
            setOptional(statement, 6, day.initialActivity());
            setOptional(statement, 7, day.currentActivity());
            statement.executeUpdate();
        }
    }

    private void upsertMeeting(Meeting meeting, int position) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO meetings
                    (id, work_day_id, position, title, meeting_type, attendee_count, status,
                     started_at, stopped_at, duration_minutes)
                VALUES
                    (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id) DO UPDATE SET
                    status=excluded.status,
                    stopped_at=excluded.stopped_at,
                    duration_minutes=excluded.duration_minutes
                """)) {
            statement.setString(1, meeting.id().toString());
            statement.setString(2, meeting.workDayId().toString());
            statement.setInt(3, position);
            statement.setString(4, meeting.title());
            statement.setString(5, meeting.meetingType().name());
            statement.setInt(6, meeting.attendeeCount());
            statement.setString(7, meeting.status().name());
            statement.setString(8, meeting.startedAt().toString());
            setOptional(statement, 9, meeting.stoppedAt().map(Instant::toString));
            statement.setInt(10, meeting.durationMinutes());
            statement.executeUpdate();
        }
    }

    // Entries are append-only, so an existing row is never rewritten.
    private void insertEntry(TimeEntry entry, int position) throws SQLException, JsonProcessingException {
        try (PreparedStatement statement = connection.prepareStatement("""
                INSERT OR IGNORE INTO time_entries
                    (id, work_day_id, position, description, duration_minutes, recorded_at,
                     commit_hash, jira_ticket, project, tags)
                VALUES
                    (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """)) {
            statement.setString(1, entry.id().toString());
            statement.setString(2, entry.workDayId().toString());
            statement.setInt(3, position);
            statement.setString(4, entry.description());
            statement.setInt(5, entry.durationMinutes());
            statement.setString(6, entry.recordedAt().toString());
            setOptional(statement, 7, entry.commitHash());
            setOptional(statement, 8, entry.jiraTicket());
            setOptional(statement, 9, entry.project());
            statement.setString(10, mapper.writeValueAsString(List.copyOf(entry.tags())));
            statement.executeUpdate();
        }
    }

    private List<WorkDay> readWorkDays(PreparedStatement statement) throws SQLException {
        List<WorkDay> days = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                UUID id = UUID.fromString(resultSet.getString("id"));
                days.add(new WorkDay(
                        id,
                        resultSet.getString("owner_id"),
                        WorkDayStatus.valueOf(resultSet.getString("status")),
                        optionalInstant(resultSet.getString("started_at")),
                        optionalInstant(resultSet.getString("ended_at")),
                        optionalText(resultSet.getString("initial_activity")),
                        optionalText(resultSet.getString("current_activity")),
                        List.of(),
                        List.of()));
            }
        }
        List<WorkDay> loaded = new ArrayList<>(days.size());
        for (WorkDay day : days) {
            loaded.add(new WorkDay(day.id(), day.ownerId(), day.status(), day.startedAt(), day.endedAt(),
                    day.initialActivity(), day.currentActivity(), readMeetings(day.id()), readEntries(day.id())));
        }
        return loaded;
    }

    private List<Meeting> readMeetings(UUID workDayId) throws SQLException {
        List<Meeting> meetings = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT id, title, meeting_type, attendee_count, status, started_at, stopped_at, duration_minutes
                FROM meetings
                WHERE work_day_id = ?
                ORDER BY position
                """)) {
            statement.setString(1, workDayId.toString());
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    meetings.add(new Meeting(
                            UUID.fromString(resultSet.getString("id")),
                            workDayId,
                            resultSet.getString("title"),
                            MeetingType.valueOf(resultSet.getString("meeting_type")),
                            resultSet.getInt("attendee_count"),
                            MeetingStatus.valueOf(resultSet.getString("status")),
                            Instant.parse(resultSet.getString("started_at")),
                            optionalInstant(resultSet.getString("stopped_at")),
                            resultSet.getInt("duration_minutes")));
                }
            }
        }
        return meetings;
    }

    private List<TimeEntry> readEntries(UUID workDayId) throws SQLException {
        List<TimeEntry> entries = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT id, description, duration_minutes, recorded_at, commit_hash, jira_ticket, project, tags
                FROM time_entries
                WHERE work_day_id = ?
                ORDER BY position
                """)) {
            statement.setString(1, workDayId.toString());
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    entries.add(new TimeEntry(
                            UUID.fromString(resultSet.getString("id")),
                            workDayId,
                            resultSet.getString("description"),
                            resultSet.getInt("duration_minutes"),
                            Instant.parse(resultSet.getString("recorded_at")),
                            optionalText(resultSet.getString("commit_hash")),
                            optionalText(resultSet.getString("jira_ticket")),
                            optionalText(resultSet.getString("project")),
                            parseTags(resultSet.getString("tags"))));
                }
            }
        }
        return entries;
    }

    private Set<String> parseTags(String json) throws SQLException {
        if (StringUtils.isBlank(json)) {
            return Set.of();
        }
        try {
            return TimeEntry.normalizeTags(mapper.readValue(json, TAG_LIST));
        } catch (JsonProcessingException ex) {
            throw new SQLException("Corrupt tag list: " + json, ex);
        }
    }

    // Closes the implicit read transaction so the next save starts clean.
    private void endRead() throws StorageException {
        try {
            connection.commit();
        } catch (SQLException ex) {
            throw new StorageException("Failed to finish SQLite read", ex);
        }
    }

    private static void setOptional(PreparedStatement statement, int index, Optional<String> value) throws SQLException {
        if (value.isPresent() && StringUtils.isNotBlank(value.get())) {
            statement.setString(index, value.get());
        } else {
            statement.setNull(index, Types.VARCHAR);
        }
    }

    private static Optional<Instant> optionalInstant(String value) {
        return StringUtils.isBlank(value) ? Optional.empty() : Optional.of(Instant.parse(value));
    }

    private static Optional<String> optionalText(String value) {
        return Optional.ofNullable(value).filter(StringUtils::isNotBlank);
    }

    private void configurePragma(Connection connection, String journalMode, Integer busyTimeoutMillis)
            throws SQLException {
        if (StringUtils.isNotBlank(journalMode)) {
            String mode = journalMode.trim().toUpperCase(Locale.ROOT);
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA journal_mode=" + mode);
            }
        }
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA foreign_keys=ON");
            if (busyTimeoutMillis != null && busyTimeoutMillis >= 0) {
                statement.execute("PRAGMA busy_timeout=" + busyTimeoutMillis);
            }
        }
    }

    private void createSchema(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS work_days (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        id TEXT NOT NULL UNIQUE,
                        owner_id TEXT NOT NULL,
                        status TEXT NOT NULL,
                        started_at TEXT,
                        ended_at TEXT,
                        initial_activity TEXT,
                        current_activity TEXT,
                        created_at TEXT NOT NULL DEFAULT (datetime('now')),
                        updated_at TEXT NOT NULL DEFAULT (datetime('now'))
                    )
                    """);
            statement.execute("""
                    CREATE INDEX IF NOT EXISTS idx_work_days_owner
                    ON work_days(owner_id, seq)
                    """);
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS meetings (
                        id TEXT PRIMARY KEY,
                        work_day_id TEXT NOT NULL REFERENCES work_days(id),
                        position INTEGER NOT NULL,
                        title TEXT NOT NULL,
                        meeting_type TEXT NOT NULL,
                        attendee_count INTEGER NOT NULL DEFAULT 0,
                        status TEXT NOT NULL,
                        started_at TEXT NOT NULL,
                        stopped_at TEXT,
                        duration_minutes INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS time_entries (
                        id TEXT PRIMARY KEY,
                        work_day_id TEXT NOT NULL REFERENCES work_days(id),
                        position INTEGER NOT NULL,
                        description TEXT NOT NULL,
                        duration_minutes INTEGER NOT NULL,
                        recorded_at TEXT NOT NULL,
                        commit_hash TEXT,
                        jira_ticket TEXT,
                        project TEXT,
                        tags TEXT NOT NULL DEFAULT '[]'
                    )
                    """);
        }
    }
}
