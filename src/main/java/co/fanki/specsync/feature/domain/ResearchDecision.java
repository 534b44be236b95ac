package co.fanki.specsync.feature.domain;

import co.fanki.specsync.shared.Preconditions;

import java.util.List;
import java.util.UUID;

/**
 * A decision recorded in a feature's {@code research.md}, identified within
 * the feature by its title.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ResearchDecision {

    private final String id;
    private final String featureId;
    private final String title;
    private final String decision;
    private final String rationale;
    private final List<String> alternatives;
    private final String context;

    private ResearchDecision(
            final String theId,
            final String theFeatureId,
            final String theTitle,
            final String theDecision,
            final String theRationale,
            final List<String> theAlternatives,
            final String theContext) {
        this.id = Preconditions.requireNonBlank(theId,
                "Decision ID is required");
        this.featureId = Preconditions.requireNonBlank(theFeatureId,
                "Feature ID is required");
        this.title = Preconditions.requireNonBlank(theTitle,
                "Decision title is required");
        this.decision = theDecision != null ? theDecision : "";
        this.rationale = theRationale;
        this.alternatives = theAlternatives != null
                ? List.copyOf(theAlternatives) : List.of();
        this.context = theContext;
    }

    /**
     * Creates a new research decision.
     *
     * @param featureId the owning feature ID
     * @param title the decision title
     * @param decision the decision text
     * @param rationale the rationale, may be null
     * @param alternatives the alternatives considered
     * @param context implementation notes, may be null
     * @return a new ResearchDecision instance
     */
    public static ResearchDecision create(
            final String featureId,
            final String title,
            final String decision,
            final String rationale,
            final List<String> alternatives,
            final String context) {
        return new ResearchDecision(UUID.randomUUID().toString(), featureId,
                title, decision, rationale, alternatives, context);
    }

    /**
     * Reconstitutes a research decision from persistence.
     *
     * @return the reconstituted ResearchDecision
     */
    public static ResearchDecision reconstitute(
            final String id,
            final String featureId,
            final String title,
            final String decision,
            final String rationale,
            final List<String> alternatives,
            final String context) {
        return new ResearchDecision(id, featureId, title, decision, rationale,
                alternatives, context);
    }

    public String id() {
        return id;
    }

    public String featureId() {
        return featureId;
    }

    public String title() {
        return title;
    }

    public String decision() {
        return decision;
    }

    public String rationale() {
        return rationale;
    }

    public List<String> alternatives() {
        return alternatives;
    }

    public String context() {
        return context;
    }

}
