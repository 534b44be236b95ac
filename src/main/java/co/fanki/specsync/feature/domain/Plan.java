package co.fanki.specsync.feature.domain;

import co.fanki.specsync.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The implementation plan of a feature; at most one per feature.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Plan {

    private final String id;
    private final String featureId;
    private final String summary;
    private final Map<String, String> techStack;
    private final List<PlanPhase> phases;
    private final List<String> dependencies;
    private final List<Risk> risks;

    private Plan(
            final String theId,
            final String theFeatureId,
            final String theSummary,
            final Map<String, String> theTechStack,
            final List<PlanPhase> thePhases,
            final List<String> theDependencies,
            final List<Risk> theRisks) {
        this.id = Preconditions.requireNonBlank(theId, "Plan ID is required");
        this.featureId = Preconditions.requireNonBlank(theFeatureId,
                "Feature ID is required");
        this.summary = theSummary;
        this.techStack = theTechStack != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(theTechStack))
                : Map.of();
        this.phases = thePhases != null ? List.copyOf(thePhases) : List.of();
        this.dependencies = theDependencies != null
                ? List.copyOf(theDependencies) : List.of();
        this.risks = theRisks != null ? List.copyOf(theRisks) : List.of();
    }

    /**
     * Creates a new plan.
     *
     * @param featureId the owning feature ID
     * @param summary the summary, may be null
     * @param techStack the technical context entries
     * @param phases the phases in order
     * @param dependencies the dependencies
     * @param risks the risks with their mitigations
     * @return a new Plan instance
     */
    public static Plan create(
            final String featureId,
            final String summary,
            final Map<String, String> techStack,
            final List<PlanPhase> phases,
            final List<String> dependencies,
            final List<Risk> risks) {
        return new Plan(UUID.randomUUID().toString(), featureId, summary,
                techStack, phases, dependencies, risks);
    }

    /**
     * Reconstitutes a plan from persistence.
     *
     * @return the reconstituted Plan
     */
    public static Plan reconstitute(
            final String id,
            final String featureId,
            final String summary,
            final Map<String, String> techStack,
            final List<PlanPhase> phases,
            final List<String> dependencies,
            final List<Risk> risks) {
        return new Plan(id, featureId, summary, techStack, phases,
                dependencies, risks);
    }

    public String id() {
        return id;
    }

    public String featureId() {
        return featureId;
    }

    public String summary() {
        return summary;
    }

    public Map<String, String> techStack() {
        return techStack;
    }

    public List<PlanPhase> phases() {
        return phases;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public List<Risk> risks() {
        return risks;
    }

}
