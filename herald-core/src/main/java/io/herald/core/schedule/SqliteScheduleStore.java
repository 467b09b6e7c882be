package io.herald.core.schedule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteScheduleStore implements ScheduleStore, UserTimezoneStore {
    private static final String SCHEDULE_COLUMNS =
        "id, user_id, title, message, channel_id, repeat_type, repeat_value, active, timezone";

    private final String jdbcUrl;

    public SqliteScheduleStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    @Override
    public synchronized List<Schedule> getActiveSchedules() throws IOException {
        String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM schedules WHERE active = 1 ORDER BY id ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            return readAll(resultSet);
        } catch (SQLException e) {
            throw new IOException("Failed to load active schedules", e);
        }
    }

    @Override
    public synchronized Optional<Schedule> find(long id) throws IOException {
        String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM schedules WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(read(resultSet));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load schedule " + id, e);
        }
    }

    @Override
    public synchronized void setActive(long id, boolean active) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("UPDATE schedules SET active = ? WHERE id = ?")) {
            statement.setInt(1, active ? 1 : 0);
            statement.setLong(2, id);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to update active flag of schedule " + id, e);
        }
    }

    @Override
    public synchronized Schedule insert(Schedule schedule) throws IOException {
        String sql = """
            INSERT INTO schedules (user_id, title, message, channel_id, repeat_type, repeat_value, active, timezone)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bindContent(statement, schedule);
            statement.setInt(7, schedule.active() ? 1 : 0);
            statement.setString(8, schedule.ownerTimezone());
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new IOException("Schedule insert returned no id");
                }
                long id = keys.getLong(1);
                return new Schedule(
                    id,
                    schedule.ownerId(),
                    schedule.title(),
                    schedule.message(),
                    schedule.channel(),
                    schedule.repeatType(),
                    schedule.repeatValue(),
                    schedule.active(),
                    schedule.ownerTimezone()
                );
            }
        } catch (SQLException e) {
            throw new IOException("Failed to insert schedule", e);
        }
    }

    @Override
    public synchronized boolean update(Schedule schedule) throws IOException {
        String sql = """
            UPDATE schedules
            SET user_id = ?, title = ?, message = ?, channel_id = ?, repeat_type = ?, repeat_value = ?,
                active = ?, timezone = ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bindContent(statement, schedule);
            statement.setInt(7, schedule.active() ? 1 : 0);
            statement.setString(8, schedule.ownerTimezone());
            statement.setLong(9, schedule.id());
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update schedule " + schedule.id(), e);
        }
    }

    @Override
    public synchronized boolean delete(long id) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM schedules WHERE id = ?")) {
            statement.setLong(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete schedule " + id, e);
        }
    }

    @Override
    public synchronized List<Schedule> listByOwner(String ownerId) throws IOException {
        String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM schedules WHERE user_id = ? ORDER BY id ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, ownerId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return readAll(resultSet);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list schedules of " + ownerId, e);
        }
    }

    @Override
    public synchronized List<Schedule> listAll() throws IOException {
        String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM schedules ORDER BY id ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            return readAll(resultSet);
        } catch (SQLException e) {
            throw new IOException("Failed to list schedules", e);
        }
    }

    @Override
    public synchronized Optional<String> find(String userId) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT timezone FROM users WHERE id = ?")) {
            statement.setString(1, userId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(resultSet.getString("timezone"));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load timezone of " + userId, e);
        }
    }

    @Override
    public synchronized void save(String userId, String timezone) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                 "INSERT OR REPLACE INTO users (id, timezone) VALUES (?, ?)")) {
            statement.setString(1, userId);
            statement.setString(2, timezone);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to save timezone of " + userId, e);
        }
    }

    private void bindContent(PreparedStatement statement, Schedule schedule) throws SQLException {
        statement.setString(1, schedule.ownerId());
        statement.setString(2, safe(schedule.title()));
        statement.setString(3, safe(schedule.message()));
        statement.setString(4, safe(schedule.channel()));
        statement.setString(5, schedule.repeatType().label());
        statement.setString(6, safe(schedule.repeatValue()));
    }

    private List<Schedule> readAll(ResultSet resultSet) throws SQLException {
        List<Schedule> schedules = new ArrayList<>();
        while (resultSet.next()) {
            schedules.add(read(resultSet));
        }
        return schedules;
    }

    private Schedule read(ResultSet resultSet) throws SQLException {
        String rawType = resultSet.getString("repeat_type");
        long id = resultSet.getLong("id");
        RepeatType repeatType = RepeatType.parse(rawType)
            .orElseThrow(() -> new SQLException("Unknown repeat type '" + rawType + "' on schedule " + id));
        return new Schedule(
            id,
            resultSet.getString("user_id"),
            resultSet.getString("title"),
            resultSet.getString("message"),
            resultSet.getString("channel_id"),
            repeatType,
            resultSet.getString("repeat_value"),
            resultSet.getInt("active") != 0,
            resultSet.getString("timezone")
        );
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String users = """
            CREATE TABLE IF NOT EXISTS users (
                id TEXT PRIMARY KEY,
                timezone TEXT DEFAULT 'Asia/Kolkata'
            )
            """;
        String schedules = """
            CREATE TABLE IF NOT EXISTS schedules (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id TEXT NOT NULL,
                title TEXT NOT NULL,
                message TEXT NOT NULL,
                channel_id TEXT NOT NULL,
                repeat_type TEXT NOT NULL,
                repeat_value TEXT,
                active BOOLEAN DEFAULT 1,
                timezone TEXT DEFAULT 'Asia/Kolkata'
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_schedules_active
            ON schedules(active)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(users);
            statement.execute(schedules);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite schedule store", e);
        }
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
