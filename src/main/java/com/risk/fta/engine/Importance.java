package com.risk.fta.engine;

/**
 * Importance factors of one basic event.
 *
 * @param eventId       Basic event id.
 * @param probability   Best-estimate probability of the event.
 * @param contribution  Summed probability of the cut sets containing the event.
 * @param fussellVesely Contribution divided by the top event probability.
 * @param birnbaum      Marginal importance: {@code P(top | e) - P(top | not e)}.
 * @param criticality   {@code birnbaum * p / P(top)}.
 * @param raw           Risk achievement worth: {@code P(top | e) / P(top)}.
 * @param rrw           Risk reduction worth: {@code P(top) / P(top | not e)}.
 */
public record Importance(String eventId, double probability, double contribution, double fussellVesely,
        double birnbaum, double criticality, double raw, double rrw) {
}
