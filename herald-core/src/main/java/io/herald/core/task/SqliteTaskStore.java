package io.herald.core.task;

import io.herald.core.dispatch.MessageKind;
import java.io.IOException;
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
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteTaskStore implements TaskStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteTaskStore.class);

    private static final String COLUMNS = """
        id, name, webhook_url, message_kind, message_content, file_path,
        schedule_expression, next_run_at, active, created_at, updated_at
        """;

    private final String jdbcUrl;

    public SqliteTaskStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    @Override
    public synchronized RecurringTask create(RecurringTask draft) throws IOException {
        String sql = """
            INSERT INTO recurring_tasks (
                name, webhook_url, message_kind, message_content, file_path,
                schedule_expression, next_run_at, active, created_at, updated_at
            )
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            statement.setString(1, draft.name());
            statement.setString(2, draft.webhookUrl());
            statement.setString(3, draft.messageKind().wireName());
            statement.setString(4, draft.messageContent());
            statement.setString(5, draft.filePath());
            statement.setString(6, draft.scheduleExpression());
            setInstant(statement, 7, draft.nextRunAt());
            statement.setInt(8, draft.active() ? 1 : 0);
            setInstant(statement, 9, draft.createdAt());
            setInstant(statement, 10, draft.updatedAt());
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new IOException("No id generated for task " + draft.name());
                }
                return draft.withId(keys.getLong(1));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to create task " + draft.name(), e);
        }
    }

    @Override
    public synchronized boolean update(long id, RecurringTask values, Set<TaskField> fields) throws IOException {
        Set<TaskField> ordered = EnumSet.noneOf(TaskField.class);
        ordered.addAll(fields);
        String assignments = ordered.stream()
            .map(field -> field.column() + " = ?")
            .collect(Collectors.joining(", "));
        String sql = "UPDATE recurring_tasks SET "
            + (assignments.isEmpty() ? "" : assignments + ", ")
            + "updated_at = ? WHERE id = ?";

        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = 1;
            for (TaskField field : ordered) {
                bind(statement, index++, field, values);
            }
            setInstant(statement, index++, values.updatedAt());
            statement.setLong(index, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update task " + id, e);
        }
    }

    @Override
    public synchronized boolean delete(long id) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM recurring_tasks WHERE id = ?")) {
            statement.setLong(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete task " + id, e);
        }
    }

    @Override
    public synchronized Optional<RecurringTask> get(long id) throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM recurring_tasks WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(read(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load task " + id, e);
        }
    }

    @Override
    public synchronized List<RecurringTask> listAll() throws IOException {
        return query("SELECT " + COLUMNS + " FROM recurring_tasks ORDER BY id ASC", null, "Failed to list tasks");
    }

    @Override
    public synchronized List<RecurringTask> listActive() throws IOException {
        return query(
            "SELECT " + COLUMNS + " FROM recurring_tasks WHERE active = 1 ORDER BY id ASC",
            null,
            "Failed to list active tasks"
        );
    }

    @Override
    public synchronized List<RecurringTask> listDue(Instant now) throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM recurring_tasks"
            + " WHERE active = 1 AND next_run_at IS NOT NULL AND next_run_at <= ?"
            + " ORDER BY next_run_at ASC, id ASC";
        return query(sql, now, "Failed to list due tasks");
    }

    @Override
    public synchronized boolean updateNextRunAt(long id, String expectedExpression, Instant nextRunAt) throws IOException {
        String sql = """
            UPDATE recurring_tasks
            SET next_run_at = ?
            WHERE id = ? AND schedule_expression = ? AND (next_run_at IS NULL OR next_run_at <= ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            setInstant(statement, 1, nextRunAt);
            statement.setLong(2, id);
            statement.setString(3, expectedExpression);
            setInstant(statement, 4, nextRunAt);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update next run of task " + id, e);
        }
    }

    private List<RecurringTask> query(String sql, Instant parameter, String failure) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            if (parameter != null) {
                setInstant(statement, 1, parameter);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                List<RecurringTask> tasks = new ArrayList<>();
                while (resultSet.next()) {
                    tasks.add(read(resultSet));
                }
                return tasks;
            }
        } catch (SQLException e) {
            throw new IOException(failure, e);
        }
    }

    private void bind(PreparedStatement statement, int index, TaskField field, RecurringTask values) throws SQLException {
        switch (field) {
            case NAME -> statement.setString(index, values.name());
            case WEBHOOK_URL -> statement.setString(index, values.webhookUrl());
            case MESSAGE_KIND -> statement.setString(index, values.messageKind().wireName());
            case MESSAGE_CONTENT -> statement.setString(index, values.messageContent());
            case FILE_PATH -> statement.setString(index, values.filePath());
            case SCHEDULE_EXPRESSION -> statement.setString(index, values.scheduleExpression());
            case NEXT_RUN_AT -> setInstant(statement, index, values.nextRunAt());
            case ACTIVE -> statement.setInt(index, values.active() ? 1 : 0);
        }
    }

    private RecurringTask read(ResultSet resultSet) throws SQLException {
        long id = resultSet.getLong("id");
        String storedKind = resultSet.getString("message_kind");
        MessageKind kind = MessageKind.fromWireName(storedKind).orElseGet(() -> {
            LOG.warn("Task {} has unknown message kind '{}', reading it as text", id, storedKind);
            return MessageKind.TEXT;
        });
        return new RecurringTask(
            id,
            resultSet.getString("name"),
            resultSet.getString("webhook_url"),
            kind,
            resultSet.getString("message_content"),
            resultSet.getString("file_path"),
            resultSet.getString("schedule_expression"),
            getInstant(resultSet, "next_run_at"),
            resultSet.getInt("active") == 1,
            getInstant(resultSet, "created_at"),
            getInstant(resultSet, "updated_at")
        );
    }

    private static void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : Instant.ofEpochMilli(value);
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
        String ddl = """
            CREATE TABLE IF NOT EXISTS recurring_tasks (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                webhook_url TEXT NOT NULL,
                message_kind TEXT NOT NULL,
                message_content TEXT,
                file_path TEXT,
                schedule_expression TEXT NOT NULL,
                next_run_at INTEGER,
                active INTEGER NOT NULL DEFAULT 1,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_recurring_tasks_due
            ON recurring_tasks(active, next_run_at)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite task store", e);
        }
    }
}
