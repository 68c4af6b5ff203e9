package inkwell.coordinator.store;

import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.TaskLogEntry;
import inkwell.coordinator.model.TaskOutcome;
import inkwell.coordinator.repository.TaskLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of TaskLogRepository.
 */
public class JdbcTaskLogRepository implements TaskLogRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskLogRepository.class);

    private final Database db;

    public JdbcTaskLogRepository(Database db) {
        this.db = db;
    }

    @Override
    public void record(TaskLogEntry entry) {
        String sql = """
                    INSERT INTO task_log (message_id, task_id, run_id, stage, role, subject, attempt, outcome,
                                          error_message, dispatched_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entry.messageId());
            ps.setString(2, entry.taskId());
            ps.setString(3, entry.runId());
            ps.setString(4, entry.stage().name());
            ps.setString(5, entry.role());
            ps.setString(6, entry.subject());
            ps.setInt(7, entry.attempt());
            ps.setString(8, entry.outcome().name());
            ps.setString(9, truncate(entry.error()));
            setTimestamp(ps, 10, entry.dispatchedAt());
            setTimestamp(ps, 11, entry.finishedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record task attempt: " + entry.messageId(), e);
        }
    }

    @Override
    public boolean finish(String messageId, TaskOutcome outcome, String error, Instant finishedAt) {
        String sql = "UPDATE task_log SET outcome = ?, error_message = ?, finished_at = ? WHERE message_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, outcome.name());
            ps.setString(2, truncate(error));
            setTimestamp(ps, 3, finishedAt);
            ps.setString(4, messageId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish task attempt: " + messageId, e);
        }
    }

    @Override
    public int finishPending(String runId, TaskOutcome outcome, Instant finishedAt) {
        String sql = "UPDATE task_log SET outcome = ?, finished_at = ? WHERE run_id = ? AND outcome = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, outcome.name());
            setTimestamp(ps, 2, finishedAt);
            ps.setString(3, runId);
            ps.setString(4, TaskOutcome.DISPATCHED.name());

            int updated = ps.executeUpdate();
            conn.commit();
            if (updated > 0) {
                log.debug("Marked {} pending attempts of run {} as {}", updated, runId, outcome);
            }
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish pending attempts of run: " + runId, e);
        }
    }

    @Override
    public List<TaskLogEntry> findByRun(String runId) {
        String sql = "SELECT * FROM task_log WHERE run_id = ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            List<TaskLogEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(mapRow(rs));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task log of run: " + runId, e);
        }
    }

    @Override
    public int countByRun(String runId) {
        String sql = "SELECT COUNT(*) FROM task_log WHERE run_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count task log of run: " + runId, e);
        }
    }

    private TaskLogEntry mapRow(ResultSet rs) throws SQLException {
        return new TaskLogEntry(
                rs.getString("message_id"),
                rs.getString("task_id"),
                rs.getString("run_id"),
                Stage.valueOf(rs.getString("stage")),
                rs.getString("role"),
                rs.getString("subject"),
                rs.getInt("attempt"),
                TaskOutcome.valueOf(rs.getString("outcome")),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("dispatched_at")),
                toInstant(rs.getTimestamp("finished_at")));
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 2048) {
            return error;
        }
        return error.substring(0, 2048);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
