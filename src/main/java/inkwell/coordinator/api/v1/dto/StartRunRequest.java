package inkwell.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import inkwell.coordinator.model.RunOptions;

/**
 * Request DTO for starting a run.
 * POST /api/v1/runs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StartRunRequest(
        @JsonProperty("topic") String topic,
        @JsonProperty("styleGuide") String styleGuide,
        @JsonProperty("targetLength") Integer targetLength) {

    private static final int MAX_TOPIC_LENGTH = 500;
    private static final int MAX_STYLE_GUIDE_LENGTH = 4000;

    public void validate() {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        if (topic.length() > MAX_TOPIC_LENGTH) {
            throw new IllegalArgumentException("topic must be at most " + MAX_TOPIC_LENGTH + " characters");
        }
        if (styleGuide != null && styleGuide.length() > MAX_STYLE_GUIDE_LENGTH) {
            throw new IllegalArgumentException(
                    "styleGuide must be at most " + MAX_STYLE_GUIDE_LENGTH + " characters");
        }
        if (targetLength != null && targetLength < 1) {
            throw new IllegalArgumentException("targetLength must be positive");
        }
    }

    public RunOptions options() {
        return new RunOptions(styleGuide, targetLength);
    }
}
