package co.fanki.specsync.parsing.domain;

import java.util.List;

/**
 * The content extracted from a {@code spec.md} document.
 *
 * @param title the H1 text without its "Feature Specification:" prefix,
 *              null when the document has no H1
 * @param status the lower-cased {@code **Status**:} value, "draft" when
 *               absent
 * @param createdDate the {@code **Created**:} value, may be null
 * @param featureBranch the {@code **Feature Branch**:} value, may be null
 * @param userStories the user stories in document order
 * @param requirements the requirements in document order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ParsedSpec(
        String title,
        String status,
        String createdDate,
        String featureBranch,
        List<UserStory> userStories,
        List<ParsedRequirement> requirements
) {

    /** Status assumed when a specification declares none. */
    public static final String DEFAULT_STATUS = "draft";

    /**
     * Copies the collections.
     */
    public ParsedSpec {
        status = status == null ? DEFAULT_STATUS : status;
        userStories = List.copyOf(userStories);
        requirements = List.copyOf(requirements);
    }

    /**
     * One user story.
     *
     * @param title the story heading without its priority marker
     * @param priority P1, P2 or P3
     * @param description the first plain paragraph under the heading
     * @param acceptanceScenarios the list items under the story
     */
    public record UserStory(
            String title,
            String priority,
            String description,
            List<String> acceptanceScenarios
    ) {

        /** Priority assumed for stories without a marker. */
        public static final String DEFAULT_PRIORITY = "P2";

        /**
         * Copies the scenarios.
         */
        public UserStory {
            description = description == null ? "" : description;
            acceptanceScenarios = List.copyOf(acceptanceScenarios);
        }
    }

}
