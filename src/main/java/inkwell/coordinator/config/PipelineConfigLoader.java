package inkwell.coordinator.config;

import inkwell.coordinator.model.Stage;
import inkwell.coordinator.resolver.RolePriorityRanking;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link PipelineConfig} from an INI file.
 *
 * <pre>
 * [pipeline]
 * merge_strategy = none
 * max_attempts = 3
 * stage_deadline = 60s
 * failure_threshold = 0.5
 *
 * [priority]
 * editor = 50
 * writer = 30
 * ; rank of writer for subject "tone" only
 * writer@tone = 60
 *
 * [stage.editing]
 * deadline = 90s
 * editor = body, tone
 * writer = tone
 * </pre>
 *
 * Anything not set keeps the value from {@link PipelineConfig#defaults()}. A file with at least one
 * stage section replaces the whole default roster.
 */
public final class PipelineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    private static final String STAGE_PREFIX = "stage.";
    private static final String DEADLINE_KEY = "deadline";

    private PipelineConfigLoader() {
    }

    public static PipelineConfig load(File file) throws IOException {
        Ini ini = new Ini(file);
        PipelineConfig config = fromIni(ini);
        log.info("Loaded pipeline config from {}: {}", file, config);
        return config;
    }

    static PipelineConfig fromIni(Ini ini) {
        PipelineConfig.Builder builder = PipelineConfig.defaults().toBuilder();

        Profile.Section pipeline = ini.get("pipeline");
        if (pipeline != null) {
            String merge = opt(pipeline, "merge_strategy");
            if (merge != null) {
                builder.mergeStrategy(merge);
            }
            String v;
            if ((v = opt(pipeline, "max_attempts")) != null) {
                builder.maxAttempts(Integer.parseInt(v));
            }
            if ((v = opt(pipeline, "stage_deadline")) != null) {
                builder.stageDeadline(parseDuration(v));
            }
            if ((v = opt(pipeline, "failure_threshold")) != null) {
                builder.failureThreshold(Double.parseDouble(v));
            }
            if ((v = opt(pipeline, "short_term_capacity")) != null) {
                builder.shortTermCapacity(Integer.parseInt(v));
            }
            if ((v = opt(pipeline, "short_term_ttl")) != null) {
                builder.shortTermTtl(parseDuration(v));
            }
            if ((v = opt(pipeline, "queue_capacity")) != null) {
                builder.queueCapacity(Integer.parseInt(v));
            }
            if ((v = opt(pipeline, "queue_lease")) != null) {
                builder.queueLease(parseDuration(v));
            }
            if ((v = opt(pipeline, "poll_interval")) != null) {
                builder.pollInterval(parseDuration(v));
            }
            if ((v = opt(pipeline, "long_term_retention")) != null) {
                builder.longTermRetention(parseDuration(v));
            }
            if ((v = opt(pipeline, "slow_contributor")) != null) {
                builder.slowContributor(parseDuration(v));
            }
        }

        Profile.Section priority = ini.get("priority");
        if (priority != null) {
            RolePriorityRanking.Builder ranking = RolePriorityRanking.builder();
            for (String key : priority.keySet()) {
                int rank = Integer.parseInt(priority.get(key).trim());
                int at = key.indexOf('@');
                if (at > 0) {
                    ranking.override(key.substring(at + 1).trim(), key.substring(0, at).trim(), rank);
                } else {
                    ranking.rank(key.trim(), rank);
                }
            }
            builder.ranking(ranking.build());
        }

        boolean stagesDeclared = ini.keySet().stream().anyMatch(name -> name.startsWith(STAGE_PREFIX));
        if (stagesDeclared) {
            for (Stage stage : Stage.workStages()) {
                builder.roster(StageRoster.empty(stage));
            }
        }
        for (String sectionName : ini.keySet()) {
            if (!sectionName.startsWith(STAGE_PREFIX)) {
                continue;
            }
            Stage stage = Stage.fromKey(sectionName.substring(STAGE_PREFIX.length()));
            Profile.Section section = ini.get(sectionName);
            Map<String, List<String>> roster = new LinkedHashMap<>();
            for (String key : section.keySet()) {
                String value = section.get(key);
                if (DEADLINE_KEY.equals(key)) {
                    builder.stageDeadline(stage, parseDuration(value));
                } else {
                    roster.put(key.trim(), splitList(value));
                }
            }
            builder.roster(stage, roster);
        }

        return builder.build();
    }

    /**
     * Accepts ISO-8601 ("PT30S") or a number with one of the suffixes ms, s, m, h, d.
     */
    static Duration parseDuration(String text) {
        String v = text.trim().toLowerCase(Locale.ROOT);
        try {
            if (v.startsWith("p")) {
                return Duration.parse(v.toUpperCase(Locale.ROOT));
            }
            if (v.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(v.substring(0, v.length() - 2).trim()));
            }
            long amount = Long.parseLong(v.substring(0, v.length() - 1).trim());
            return switch (v.charAt(v.length() - 1)) {
                case 's' -> Duration.ofSeconds(amount);
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                case 'd' -> Duration.ofDays(amount);
                default -> throw new IllegalArgumentException("Unknown duration unit in '" + text + "'");
            };
        } catch (NumberFormatException | DateTimeParseException | StringIndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Invalid duration '" + text + "'", e);
        }
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
