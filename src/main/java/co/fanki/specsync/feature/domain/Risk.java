package co.fanki.specsync.feature.domain;

/**
 * A risk named in a plan, paired with its mitigation.
 *
 * @param risk the risk
 * @param mitigation how the plan mitigates it
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Risk(
        String risk,
        String mitigation
) {
}
