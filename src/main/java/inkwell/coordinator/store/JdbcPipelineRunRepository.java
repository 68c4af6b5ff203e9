package inkwell.coordinator.store;

import inkwell.coordinator.model.PipelineRun;
import inkwell.coordinator.model.RunOptions;
import inkwell.coordinator.model.RunStatus;
import inkwell.coordinator.model.Stage;
import inkwell.coordinator.model.StageReport;
import inkwell.coordinator.model.StageStatus;
import inkwell.coordinator.repository.PipelineRunRepository;
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
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of PipelineRunRepository.
 * A run and its stage rows are written in one transaction.
 */
public class JdbcPipelineRunRepository implements PipelineRunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPipelineRunRepository.class);

    private final Database db;

    public JdbcPipelineRunRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(PipelineRun run) {
        String runSql = """
                    MERGE INTO pipeline_runs (id, topic, style_guide, target_length, config, current_stage, status,
                                              failure_reason, created_at, finished_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String stageSql = """
                    MERGE INTO stage_status (run_id, stage, status, expected_subjects, resolved_subjects,
                                             degraded_subjects, unresolved_subjects, missing_contributors,
                                             started_at, finished_at)
                    KEY (run_id, stage)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(runSql)) {
                ps.setString(1, run.runId());
                ps.setString(2, run.topic());
                ps.setString(3, run.options().styleGuide());
                if (run.options().targetLength() != null) {
                    ps.setInt(4, run.options().targetLength());
                } else {
                    ps.setNull(4, Types.INTEGER);
                }
                ps.setString(5, run.configSnapshot());
                ps.setString(6, run.currentStage().name());
                ps.setString(7, run.status().name());
                ps.setString(8, run.failureReason());
                setTimestamp(ps, 9, run.createdAt());
                setTimestamp(ps, 10, run.finishedAt());
                ps.executeUpdate();
            }

            try (PreparedStatement ps = conn.prepareStatement(stageSql)) {
                for (StageReport report : run.stages().values()) {
                    ps.setString(1, run.runId());
                    ps.setString(2, report.stage().name());
                    ps.setString(3, report.status().name());
                    ps.setInt(4, report.expectedSubjects());
                    ps.setInt(5, report.resolvedSubjects());
                    ps.setString(6, join(report.degradedSubjects()));
                    ps.setString(7, join(report.unresolvedSubjects()));
                    ps.setString(8, join(report.missingContributors()));
                    setTimestamp(ps, 9, report.startedAt());
                    setTimestamp(ps, 10, report.finishedAt());
                    ps.addBatch();
                }
                ps.executeBatch();
            }

            conn.commit();
            log.debug("Archived run {} ({})", run.runId(), run.status());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save pipeline run: " + run.runId(), e);
        }
    }

    @Override
    public Optional<PipelineRun> findById(String runId) {
        String sql = "SELECT * FROM pipeline_runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(conn, rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find pipeline run: " + runId, e);
        }
    }

    @Override
    public List<PipelineRun> findByStatus(RunStatus status, int limit) {
        String sql = "SELECT * FROM pipeline_runs WHERE status = ? ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            return executeQuery(conn, ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find pipeline runs by status: " + status, e);
        }
    }

    @Override
    public List<PipelineRun> findRecent(int limit) {
        String sql = "SELECT * FROM pipeline_runs ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(conn, ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list recent pipeline runs", e);
        }
    }

    private List<PipelineRun> executeQuery(Connection conn, PreparedStatement ps) throws SQLException {
        List<PipelineRun> runs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                runs.add(mapRow(conn, rs));
            }
        }
        return runs;
    }

    private PipelineRun mapRow(Connection conn, ResultSet rs) throws SQLException {
        String runId = rs.getString("id");
        PipelineRun.Builder builder = PipelineRun.builder()
                .runId(runId)
                .topic(rs.getString("topic"))
                .options(new RunOptions(rs.getString("style_guide"), rs.getObject("target_length", Integer.class)))
                .configSnapshot(rs.getString("config"))
                .currentStage(Stage.valueOf(rs.getString("current_stage")))
                .status(RunStatus.valueOf(rs.getString("status")))
                .failureReason(rs.getString("failure_reason"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")));

        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM stage_status WHERE run_id = ?")) {
            ps.setString(1, runId);
            try (ResultSet stages = ps.executeQuery()) {
                while (stages.next()) {
                    builder.stage(new StageReport(
                            Stage.valueOf(stages.getString("stage")),
                            StageStatus.valueOf(stages.getString("status")),
                            stages.getInt("expected_subjects"),
                            stages.getInt("resolved_subjects"),
                            split(stages.getString("degraded_subjects")),
                            split(stages.getString("unresolved_subjects")),
                            split(stages.getString("missing_contributors")),
                            toInstant(stages.getTimestamp("started_at")),
                            toInstant(stages.getTimestamp("finished_at"))));
                }
            }
        }
        return builder.build();
    }

    private static String join(List<String> values) {
        return values.isEmpty() ? null : String.join(",", values);
    }

    private static List<String> split(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.asList(value.split(","));
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
