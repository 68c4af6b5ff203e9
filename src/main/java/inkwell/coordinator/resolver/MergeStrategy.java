package inkwell.coordinator.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Combines the values of several candidates into one.
 */
public interface MergeStrategy {

    /** Strategy that never merges; the ranking always picks a winner. */
    MergeStrategy NONE = new MergeStrategy() {
        @Override
        public String name() {
            return "none";
        }

        @Override
        public Optional<String> merge(List<String> rankedValues) {
            return Optional.empty();
        }
    };

    String name();

    /**
     * @param rankedValues candidate values, best ranked first
     * @return the merged value, or empty if this strategy does not merge
     * @throws MergeConflictException if the values contradict each other
     */
    Optional<String> merge(List<String> rankedValues) throws MergeConflictException;

    static MergeStrategy forName(String name, ObjectMapper mapper) {
        String normalized = name == null ? "none" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "", "none" -> NONE;
            case JsonFieldMergeStrategy.NAME -> new JsonFieldMergeStrategy(mapper);
            default -> throw new IllegalArgumentException("Unknown merge strategy: " + name);
        };
    }
}
