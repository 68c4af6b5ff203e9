package inkwell.coordinator.memory;

import inkwell.coordinator.model.MemoryEntry;
import inkwell.coordinator.model.MemoryTier;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ShortTermTierTest {

    private static final Instant T0 = Instant.parse("2026-02-01T12:00:00Z");

    private ShortTermTier tier;

    @BeforeEach
    void setUp() {
        tier = new ShortTermTier(2);
    }

    private static MemoryEntry entry(String runId, String key, Duration ttl) {
        return new MemoryEntry(runId, key, "v", MemoryTier.SHORT_TERM, "writer", T0,
                ttl == null ? null : T0.plus(ttl));
    }

    @Test
    void expiryForgetsRunsLeftEmpty() {
        for (int i = 0; i < 50; i++) {
            tier.put(entry("run-" + i, "brief/writing", Duration.ofMinutes(5)));
        }
        tier.put(entry("run-keep", "brief/writing", Duration.ofMinutes(5)));
        tier.put(entry("run-keep", "scratch/outline", null));
        assertEquals(51, tier.runCount());

        assertEquals(51, tier.expire(T0.plus(Duration.ofMinutes(5))));

        assertEquals(1, tier.runCount());
        assertEquals(1, tier.size("run-keep"));
        assertTrue(tier.get("run-keep", "scratch/outline", T0.plus(Duration.ofHours(1))).isPresent());
    }

    @Test
    void expiredRunDropsItsEvictionCount() {
        tier.put(entry("run-1", "a", Duration.ofMinutes(1)));
        tier.put(entry("run-1", "b", Duration.ofMinutes(1)));
        tier.put(entry("run-1", "c", Duration.ofMinutes(1)));
        assertEquals(1, tier.evictions("run-1"));

        tier.expire(T0.plus(Duration.ofMinutes(1)));

        assertEquals(0, tier.evictions("run-1"));
        assertEquals(0, tier.runCount());
    }

    @Test
    void runIsUsableAgainAfterBeingForgotten() {
        tier.put(entry("run-1", "a", Duration.ofMinutes(1)));
        tier.expire(T0.plus(Duration.ofMinutes(1)));

        tier.put(entry("run-1", "b", null));

        assertEquals(1, tier.size("run-1"));
        assertTrue(tier.get("run-1", "b", T0).isPresent());
    }
}
