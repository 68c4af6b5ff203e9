package inkwell.coordinator.config;

import inkwell.coordinator.model.Stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Roles taking part in a stage and the subjects each of them produces.
 * Several roles listing the same subject compete for it.
 */
public final class StageRoster {

    private final Stage stage;
    private final Map<String, List<String>> subjectsByRole;

    public StageRoster(Stage stage, Map<String, List<String>> subjectsByRole) {
        if (!stage.isWorkStage()) {
            throw new IllegalArgumentException("No roster for stage " + stage);
        }
        this.stage = stage;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        subjectsByRole.forEach((role, subjects) -> {
            if (role == null || role.isBlank()) {
                throw new IllegalArgumentException("role name is required in stage " + stage.key());
            }
            for (String subject : subjects) {
                if (subject == null || subject.isBlank() || subject.contains(",") || subject.contains("/")) {
                    throw new IllegalArgumentException("Invalid subject '" + subject + "' in stage " + stage.key());
                }
            }
            if (!subjects.isEmpty()) {
                copy.put(role, List.copyOf(new LinkedHashSet<>(subjects)));
            }
        });
        this.subjectsByRole = Collections.unmodifiableMap(copy);
    }

    public static StageRoster empty(Stage stage) {
        return new StageRoster(stage, Map.of());
    }

    public Stage stage() {
        return stage;
    }

    public boolean isEmpty() {
        return subjectsByRole.isEmpty();
    }

    public Map<String, List<String>> subjectsByRole() {
        return subjectsByRole;
    }

    public Set<String> roles() {
        return subjectsByRole.keySet();
    }

    /** All subjects of the stage, in roster order. */
    public List<String> subjects() {
        Set<String> subjects = new LinkedHashSet<>();
        subjectsByRole.values().forEach(subjects::addAll);
        return new ArrayList<>(subjects);
    }

    /** Roles expected to deliver a candidate for the subject. */
    public List<String> contributors(String subject) {
        List<String> roles = new ArrayList<>();
        subjectsByRole.forEach((role, subjects) -> {
            if (subjects.contains(subject)) {
                roles.add(role);
            }
        });
        return roles;
    }

    @Override
    public String toString() {
        return stage.key() + subjectsByRole;
    }
}
