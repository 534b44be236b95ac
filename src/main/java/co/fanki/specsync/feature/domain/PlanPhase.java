package co.fanki.specsync.feature.domain;

import java.util.List;

/**
 * One phase of an implementation plan.
 *
 * @param name the phase heading
 * @param goal the first paragraph under the heading, empty when absent
 * @param order the 1-based position of the phase in the plan
 * @param tasks the list items under the heading
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PlanPhase(
        String name,
        String goal,
        int order,
        List<String> tasks
) {

    /**
     * Normalizes the phase.
     */
    public PlanPhase {
        goal = goal == null ? "" : goal;
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

}
