package inkwell.coordinator.memory;

import java.util.Map;

/**
 * Per-run overview of memory usage.
 *
 * @param writers entry count per writing role, both tiers
 */
public record MemorySummary(
        String runId,
        int shortTermEntries,
        int longTermEntries,
        long shortTermEvictions,
        Map<String, Integer> writers) {

    public MemorySummary {
        writers = Map.copyOf(writers);
    }
}
