package inkwell.coordinator.config;

import inkwell.coordinator.model.Stage;
import inkwell.coordinator.resolver.RolePriorityRanking;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a pipeline run is configured with: who works on which stage, how conflicts
 * are ranked, and the limits that bound waiting, retries and memory.
 * Immutable; use {@link #builder()} or {@link #toBuilder()} to derive a variant.
 */
public final class PipelineConfig {

    private final Map<Stage, StageRoster> rosters;
    private final RolePriorityRanking ranking;
    private final String mergeStrategy;
    private final Duration stageDeadline;
    private final Map<Stage, Duration> stageDeadlines;
    private final int maxAttempts;
    private final int shortTermCapacity;
    private final Duration shortTermTtl;
    private final int queueCapacity;
    private final Duration queueLease;
    private final double failureThreshold;
    private final Duration pollInterval;
    private final Duration longTermRetention;
    private final Duration slowContributor;

    private PipelineConfig(Builder b) {
        EnumMap<Stage, StageRoster> r = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.workStages()) {
            r.put(stage, b.rosters.getOrDefault(stage, StageRoster.empty(stage)));
        }
        this.rosters = Collections.unmodifiableMap(r);
        this.ranking = b.ranking != null ? b.ranking : RolePriorityRanking.of(Map.of());
        this.mergeStrategy = b.mergeStrategy;
        this.stageDeadline = b.stageDeadline;
        this.stageDeadlines = Collections.unmodifiableMap(new EnumMap<>(b.stageDeadlines));
        this.maxAttempts = b.maxAttempts;
        this.shortTermCapacity = b.shortTermCapacity;
        this.shortTermTtl = b.shortTermTtl;
        this.queueCapacity = b.queueCapacity;
        this.queueLease = b.queueLease;
        this.failureThreshold = b.failureThreshold;
        this.pollInterval = b.pollInterval;
        this.longTermRetention = b.longTermRetention;
        this.slowContributor = b.slowContributor;

        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max attempts must be >= 1");
        }
        if (failureThreshold <= 0.0 || failureThreshold > 1.0) {
            throw new IllegalArgumentException("failure threshold must be in (0, 1]");
        }
        if (stageDeadline.isNegative() || stageDeadline.isZero()) {
            throw new IllegalArgumentException("stage deadline must be positive");
        }
        stageDeadlines.forEach((stage, deadline) -> {
            if (deadline == null || deadline.isNegative() || deadline.isZero()) {
                throw new IllegalArgumentException("deadline of " + stage.key() + " must be positive");
            }
        });
        if (slowContributor.isNegative() || slowContributor.isZero()) {
            throw new IllegalArgumentException("slow contributor threshold must be positive");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("poll interval must be positive");
        }
    }

    /**
     * Content roster: research, writing, editing, optimization, illustration and publishing roles.
     * The editor and the writer both produce "tone"; the editor ranks higher.
     */
    public static PipelineConfig defaults() {
        return builder()
                .roster(Stage.RESEARCHING, Map.of("researcher", List.of("facts", "sources")))
                .roster(Stage.WRITING, Map.of("writer", List.of("draft")))
                .roster(Stage.EDITING, orderedRoster("editor", List.of("body", "tone"), "writer", List.of("tone")))
                .roster(Stage.OPTIMIZING, Map.of("seo", List.of("keywords", "meta")))
                .roster(Stage.ILLUSTRATING, Map.of("image", List.of("images")))
                .roster(Stage.PUBLISHING, Map.of("publisher", List.of("publication")))
                .ranking(RolePriorityRanking.builder()
                        .rank("publisher", 60)
                        .rank("editor", 50)
                        .rank("seo", 40)
                        .rank("writer", 30)
                        .rank("researcher", 20)
                        .rank("image", 10)
                        .build())
                .build();
    }

    private static Map<String, List<String>> orderedRoster(String role1, List<String> subjects1,
            String role2, List<String> subjects2) {
        Map<String, List<String>> roster = new LinkedHashMap<>();
        roster.put(role1, subjects1);
        roster.put(role2, subjects2);
        return roster;
    }

    public StageRoster roster(Stage stage) {
        return rosters.get(stage);
    }

    public Map<Stage, StageRoster> rosters() {
        return rosters;
    }

    public RolePriorityRanking ranking() {
        return ranking;
    }

    public String mergeStrategy() {
        return mergeStrategy;
    }

    public Duration stageDeadline(Stage stage) {
        return stageDeadlines.getOrDefault(stage, stageDeadline);
    }

    public Duration stageDeadline() {
        return stageDeadline;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public int shortTermCapacity() {
        return shortTermCapacity;
    }

    public Duration shortTermTtl() {
        return shortTermTtl;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    public Duration queueLease() {
        return queueLease;
    }

    public double failureThreshold() {
        return failureThreshold;
    }

    /** Longest slice the control loop waits before re-checking abort and deadline. */
    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration longTermRetention() {
        return longTermRetention;
    }

    /** A contributor taking longer than this from dispatch to completion raises an alert. */
    public Duration slowContributor() {
        return slowContributor;
    }

    /** Every role appearing in any roster. */
    public List<String> roles() {
        return rosters.values().stream()
                .flatMap(r -> r.roles().stream())
                .distinct()
                .toList();
    }

    /** Plain view used to snapshot the configuration into a run. */
    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, Object> stages = new LinkedHashMap<>();
        rosters.forEach((stage, roster) -> stages.put(stage.key(), roster.subjectsByRole()));
        out.put("stages", stages);
        out.put("priority", ranking.ranks());
        out.put("priorityOverrides", ranking.subjectOverrides());
        out.put("mergeStrategy", mergeStrategy);
        out.put("stageDeadlineMs", stageDeadline.toMillis());
        Map<String, Long> perStage = new LinkedHashMap<>();
        stageDeadlines.forEach((stage, deadline) -> perStage.put(stage.key(), deadline.toMillis()));
        out.put("stageDeadlinesMs", perStage);
        out.put("maxAttempts", maxAttempts);
        out.put("failureThreshold", failureThreshold);
        out.put("shortTermCapacity", shortTermCapacity);
        out.put("shortTermTtlMs", shortTermTtl.toMillis());
        out.put("queueCapacity", queueCapacity);
        out.put("queueLeaseMs", queueLease.toMillis());
        out.put("slowContributorMs", slowContributor.toMillis());
        return out;
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .ranking(ranking)
                .mergeStrategy(mergeStrategy)
                .stageDeadline(stageDeadline)
                .maxAttempts(maxAttempts)
                .shortTermCapacity(shortTermCapacity)
                .shortTermTtl(shortTermTtl)
                .queueCapacity(queueCapacity)
                .queueLease(queueLease)
                .failureThreshold(failureThreshold)
                .pollInterval(pollInterval)
                .longTermRetention(longTermRetention)
                .slowContributor(slowContributor);
        b.rosters.putAll(rosters);
        b.stageDeadlines.putAll(stageDeadlines);
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Stage, StageRoster> rosters = new EnumMap<>(Stage.class);
        private RolePriorityRanking ranking;
        private String mergeStrategy = "none";
        private Duration stageDeadline = Duration.ofSeconds(60);
        private final Map<Stage, Duration> stageDeadlines = new EnumMap<>(Stage.class);
        private int maxAttempts = 3;
        private int shortTermCapacity = 256;
        private Duration shortTermTtl = Duration.ofHours(1);
        private int queueCapacity = 1000;
        private Duration queueLease = Duration.ofSeconds(30);
        private double failureThreshold = 0.5;
        private Duration pollInterval = Duration.ofMillis(200);
        private Duration longTermRetention = Duration.ofDays(30);
        private Duration slowContributor = Duration.ofMinutes(5);

        public Builder roster(Stage stage, Map<String, List<String>> subjectsByRole) {
            rosters.put(stage, new StageRoster(stage, subjectsByRole));
            return this;
        }

        public Builder roster(StageRoster roster) {
            rosters.put(roster.stage(), roster);
            return this;
        }

        public Builder ranking(RolePriorityRanking ranking) {
            this.ranking = ranking;
            return this;
        }

        public Builder mergeStrategy(String mergeStrategy) {
            this.mergeStrategy = mergeStrategy;
            return this;
        }

        public Builder stageDeadline(Duration stageDeadline) {
            this.stageDeadline = stageDeadline;
            return this;
        }

        public Builder stageDeadline(Stage stage, Duration deadline) {
            this.stageDeadlines.put(stage, deadline);
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder shortTermCapacity(int shortTermCapacity) {
            this.shortTermCapacity = shortTermCapacity;
            return this;
        }

        public Builder shortTermTtl(Duration shortTermTtl) {
            this.shortTermTtl = shortTermTtl;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder queueLease(Duration queueLease) {
            this.queueLease = queueLease;
            return this;
        }

        public Builder failureThreshold(double failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder longTermRetention(Duration longTermRetention) {
            this.longTermRetention = longTermRetention;
            return this;
        }

        public Builder slowContributor(Duration slowContributor) {
            this.slowContributor = slowContributor;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig{roles=" + roles() + ", merge=" + mergeStrategy + ", deadline=" + stageDeadline
                + ", maxAttempts=" + maxAttempts + ", failureThreshold=" + failureThreshold + "}";
    }
}
