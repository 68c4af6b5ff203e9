package inkwell.coordinator.model;

/**
 * Optional guidance a run is started with and every stage brief carries.
 *
 * @param styleGuide   free-form house style, null when not given
 * @param targetLength wanted length of the article in words, null when not given
 */
public record RunOptions(String styleGuide, Integer targetLength) {

    private static final RunOptions NONE = new RunOptions(null, null);

    public RunOptions {
        if (styleGuide != null && styleGuide.isBlank()) {
            styleGuide = null;
        }
        if (targetLength != null && targetLength < 1) {
            throw new IllegalArgumentException("targetLength must be positive");
        }
    }

    public static RunOptions none() {
        return NONE;
    }
}
