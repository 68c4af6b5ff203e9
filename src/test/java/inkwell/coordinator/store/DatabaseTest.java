package inkwell.coordinator.store;

import inkwell.coordinator.config.CoordinatorConfig;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schema creation against the connection settings the coordinator ships with.
 */
class DatabaseTest {

    private static Database db;

    /** Default URL with the file store swapped for an in-memory one; mode flags are kept. */
    private static String defaultModeUrl(String name) {
        String url = CoordinatorConfig.defaults().databaseUrl();
        String flags = url.substring(url.indexOf(';'))
                .replace(";AUTO_SERVER=TRUE", "");
        return "jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1" + flags;
    }

    @BeforeAll
    static void setup() {
        db = new Database(defaultModeUrl("test-schema"), 2);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @Test
    void defaultUrlRunsInPostgresMode() {
        assertTrue(defaultModeUrl("x").contains("MODE=PostgreSQL"));
    }

    @Test
    void createsEveryTable() throws Exception {
        List<String> tables = new ArrayList<>();
        try (Connection conn = db.getConnection();
                ResultSet rs = conn.getMetaData().getTables(null, null, "%", new String[] { "TABLE" })) {
            while (rs.next()) {
                tables.add(rs.getString("TABLE_NAME").toLowerCase());
            }
        }

        assertTrue(tables.contains("memory_entries"));
        assertTrue(tables.contains("pipeline_runs"));
        assertTrue(tables.contains("stage_status"));
        assertTrue(tables.contains("task_log"));
    }

    @Test
    void taskLogSequenceIsAssignedInInsertOrder() throws Exception {
        String sql = """
                    INSERT INTO task_log (message_id, task_id, run_id, stage, role, subject, attempt, outcome,
                                          dispatched_at)
                    VALUES (?, 'task-1', 'run-seq', 'RESEARCHING', 'researcher', 'facts', 1, 'PENDING', ?)
                """;
        try (Connection conn = db.getConnection()) {
            try (Statement st = conn.createStatement()) {
                st.execute("DELETE FROM task_log");
            }
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (String id : List.of("m-1", "m-2", "m-3")) {
                    ps.setString(1, id);
                    ps.setTimestamp(2, Timestamp.from(Instant.parse("2026-01-01T10:00:00Z")));
                    ps.executeUpdate();
                }
            }
            conn.commit();
        }

        List<String> ordered = new ArrayList<>();
        List<Long> seqs = new ArrayList<>();
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT message_id, seq FROM task_log ORDER BY seq")) {
            while (rs.next()) {
                ordered.add(rs.getString("message_id"));
                seqs.add(rs.getLong("seq"));
            }
        }

        assertEquals(List.of("m-1", "m-2", "m-3"), ordered);
        assertTrue(seqs.get(0) < seqs.get(1) && seqs.get(1) < seqs.get(2));
    }

    @Test
    void schemaCreationIsRepeatable() {
        Database second = new Database(defaultModeUrl("test-schema"), 1);
        try {
            assertTrue(second.isHealthy());
        } finally {
            second.close();
        }
    }
}
