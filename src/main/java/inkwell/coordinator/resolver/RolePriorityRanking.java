package inkwell.coordinator.resolver;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Role priority used to rank competing candidates. Higher wins.
 * Unlisted roles rank 0; a negative rank rejects the role's candidates outright.
 * A subject may override the rank of individual roles.
 */
public final class RolePriorityRanking {

    public static final int DEFAULT_RANK = 0;

    private final Map<String, Integer> ranks;
    private final Map<String, Map<String, Integer>> subjectOverrides;

    private RolePriorityRanking(Map<String, Integer> ranks, Map<String, Map<String, Integer>> subjectOverrides) {
        this.ranks = Collections.unmodifiableMap(new LinkedHashMap<>(ranks));
        Map<String, Map<String, Integer>> copy = new HashMap<>();
        subjectOverrides.forEach((subject, m) -> copy.put(subject, Map.copyOf(m)));
        this.subjectOverrides = Collections.unmodifiableMap(copy);
    }

    public int rank(String role, String subject) {
        Map<String, Integer> override = subjectOverrides.get(subject);
        if (override != null && override.containsKey(role)) {
            return override.get(role);
        }
        return ranks.getOrDefault(role, DEFAULT_RANK);
    }

    public boolean rejects(String role, String subject) {
        return rank(role, subject) < 0;
    }

    public Map<String, Integer> ranks() {
        return ranks;
    }

    public Map<String, Map<String, Integer>> subjectOverrides() {
        return subjectOverrides;
    }

    public static RolePriorityRanking of(Map<String, Integer> ranks) {
        return new RolePriorityRanking(ranks, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Integer> ranks = new LinkedHashMap<>();
        private final Map<String, Map<String, Integer>> overrides = new HashMap<>();

        public Builder rank(String role, int rank) {
            ranks.put(role, rank);
            return this;
        }

        public Builder override(String subject, String role, int rank) {
            overrides.computeIfAbsent(subject, s -> new LinkedHashMap<>()).put(role, rank);
            return this;
        }

        public RolePriorityRanking build() {
            return new RolePriorityRanking(ranks, overrides);
        }
    }

    @Override
    public String toString() {
        return "RolePriorityRanking" + ranks;
    }
}
