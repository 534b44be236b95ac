package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.feature.domain.PlanPhase;
import co.fanki.specsync.feature.domain.Risk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The content extracted from a {@code plan.md} document.
 *
 * @param summary the first paragraph of the summary section, may be null
 * @param techStack the {@code **Key**: value} pairs of the technical
 *                  context, in document order
 * @param phases the phases in document order
 * @param dependencies the items of the dependencies section
 * @param risks the risk/mitigation pairs of the risks section
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ParsedPlan(
        String summary,
        Map<String, String> techStack,
        List<PlanPhase> phases,
        List<String> dependencies,
        List<Risk> risks
) {

    /**
     * Copies the collections, keeping the tech stack order.
     */
    public ParsedPlan {
        techStack = Collections.unmodifiableMap(new LinkedHashMap<>(techStack));
        phases = List.copyOf(phases);
        dependencies = List.copyOf(dependencies);
        risks = List.copyOf(risks);
    }

}
