package inkwell.coordinator.store;

import inkwell.coordinator.error.StoreUnavailableException;
import inkwell.coordinator.model.MemoryEntry;
import inkwell.coordinator.model.MemoryTier;
import inkwell.coordinator.repository.LongTermMemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of the long-term memory tier.
 * Every {@link SQLException} surfaces as {@link StoreUnavailableException}.
 */
public class JdbcLongTermMemoryRepository implements LongTermMemoryRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLongTermMemoryRepository.class);

    private final Database db;

    public JdbcLongTermMemoryRepository(Database db) {
        this.db = db;
    }

    @Override
    public void upsert(MemoryEntry entry) {
        String sql = """
                    MERGE INTO memory_entries (run_id, entry_key, entry_value, tier, written_by, written_at)
                    KEY (run_id, entry_key)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entry.runId());
            ps.setString(2, entry.key());
            ps.setString(3, entry.value());
            ps.setString(4, entry.tier().name());
            ps.setString(5, entry.writtenBy());
            ps.setTimestamp(6, Timestamp.from(entry.writtenAt()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to write memory entry: " + entry.key(), e);
        }
    }

    @Override
    public Optional<MemoryEntry> find(String runId, String key) {
        String sql = "SELECT * FROM memory_entries WHERE run_id = ? AND entry_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read memory entry: " + key, e);
        }
    }

    @Override
    public List<String> findKeys(String runId, String prefix) {
        String sql = "SELECT entry_key FROM memory_entries WHERE run_id = ? AND entry_key LIKE ? ESCAPE '!' ORDER BY entry_key";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ps.setString(2, likePrefix(prefix));
            List<String> keys = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString("entry_key"));
                }
            }
            return keys;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list memory keys of run " + runId, e);
        }
    }

    @Override
    public List<MemoryEntry> findByRun(String runId) {
        String sql = "SELECT * FROM memory_entries WHERE run_id = ? ORDER BY entry_key";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read memory of run " + runId, e);
        }
    }

    @Override
    public List<MemoryEntry> recall(String prefix, int limit) {
        String sql = """
                    SELECT * FROM memory_entries
                    WHERE entry_key LIKE ? ESCAPE '!'
                    ORDER BY written_at DESC, run_id, entry_key
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, likePrefix(prefix));
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to recall memory for prefix " + prefix, e);
        }
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        String sql = "DELETE FROM memory_entries WHERE written_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            int deleted = ps.executeUpdate();
            conn.commit();
            if (deleted > 0) {
                log.debug("Deleted {} long-term entries older than {}", deleted, cutoff);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to prune long-term memory", e);
        }
    }

    private List<MemoryEntry> executeQuery(PreparedStatement ps) throws SQLException {
        List<MemoryEntry> entries = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                entries.add(mapRow(rs));
            }
        }
        return entries;
    }

    private MemoryEntry mapRow(ResultSet rs) throws SQLException {
        return new MemoryEntry(
                rs.getString("run_id"),
                rs.getString("entry_key"),
                rs.getString("entry_value"),
                MemoryTier.valueOf(rs.getString("tier")),
                rs.getString("written_by"),
                rs.getTimestamp("written_at").toInstant(),
                null);
    }

    private static String likePrefix(String prefix) {
        return prefix.replace("!", "!!").replace("%", "!%").replace("_", "!_") + "%";
    }
}
