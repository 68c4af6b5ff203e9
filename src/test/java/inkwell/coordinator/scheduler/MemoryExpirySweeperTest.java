package inkwell.coordinator.scheduler;

import inkwell.coordinator.MutableClock;
import inkwell.coordinator.memory.TieredMemoryStore;
import inkwell.coordinator.model.MemoryTier;
import inkwell.coordinator.store.Database;
import inkwell.coordinator.store.JdbcLongTermMemoryRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MemoryExpirySweeperTest {

    private static Database db;
    private static JdbcLongTermMemoryRepository longTerm;

    private MutableClock clock;
    private TieredMemoryStore store;
    private MemoryExpirySweeper sweeper;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-sweeper;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        longTerm = new JdbcLongTermMemoryRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM memory_entries");
            conn.commit();
        }
        clock = MutableClock.at("2026-04-01T00:00:00Z");
        store = new TieredMemoryStore(longTerm, 50, Duration.ofMinutes(15), clock);
        sweeper = new MemoryExpirySweeper(store, longTerm, Duration.ofDays(30), clock);
    }

    @Test
    void dropsShortTermEntriesPastTheirTtl() {
        store.put("run-1", "brief/writing", "{}", MemoryTier.SHORT_TERM, "scheduler");
        clock.advance(Duration.ofMinutes(10));
        store.put("run-1", "brief/editing", "{}", MemoryTier.SHORT_TERM, "scheduler");

        clock.advance(Duration.ofMinutes(6));

        assertEquals(1, sweeper.sweep());
        assertTrue(store.get("run-1", "brief/editing").isPresent());
    }

    @Test
    void prunesLongTermEntriesPastRetention() {
        store.put("run-old", "resolved/writing/draft", "old draft", MemoryTier.LONG_TERM, "writer");
        clock.advance(Duration.ofDays(20));
        store.put("run-new", "resolved/writing/draft", "new draft", MemoryTier.LONG_TERM, "writer");

        clock.advance(Duration.ofDays(11));

        assertEquals(1, sweeper.sweep());
        assertTrue(store.get("run-old", "resolved/writing/draft").isEmpty());
        assertEquals("new draft", store.require("run-new", "resolved/writing/draft"));
    }

    @Test
    void nothingDueRemovesNothing() {
        store.put("run-1", "input/topic", "Kelp forests", MemoryTier.LONG_TERM, "scheduler");
        store.put("run-1", "brief/researching", "{}", MemoryTier.SHORT_TERM, "scheduler");

        assertEquals(0, sweeper.sweep());

        assertEquals(1, store.summarize("run-1").shortTermEntries());
        assertEquals(1, store.summarize("run-1").longTermEntries());
    }
}
