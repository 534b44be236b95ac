package co.fanki.specsync.parsing.domain;

import java.util.List;

/**
 * The decisions extracted from a {@code research.md} document.
 *
 * @param decisions the decisions in document order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ParsedResearch(List<ParsedDecision> decisions) {

    /**
     * Copies the decisions.
     */
    public ParsedResearch {
        decisions = List.copyOf(decisions);
    }

    /**
     * One research decision.
     *
     * @param title the decision heading without its ordinal prefix
     * @param decision the decision text, empty when none was found
     * @param rationale the rationale, may be null
     * @param alternatives the alternatives considered
     * @param context implementation notes or background, may be null
     */
    public record ParsedDecision(
            String title,
            String decision,
            String rationale,
            List<String> alternatives,
            String context
    ) {

        /**
         * Copies the alternatives.
         */
        public ParsedDecision {
            decision = decision == null ? "" : decision;
            alternatives = List.copyOf(alternatives);
        }
    }

}
