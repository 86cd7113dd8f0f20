package com.tony.matchPredictor.model;

/**
 * Un marché = un prédicat pur sur (buts domicile, buts extérieur).
 *
 * @param code      code unique, ex: "OU_2_5_OVER"
 * @param group     partition mutuellement exclusive et exhaustive à laquelle appartient le marché (null si aucune)
 * @param outcome   issue dans le groupe, ex: "OVER" (sert aussi aux cotes bookmakers)
 * @param predicate condition sur le score final
 */
public record MarketDefinition(String code, String group, String outcome, ScorePredicate predicate) {

    @FunctionalInterface
    public interface ScorePredicate {
        boolean test(int homeGoals, int awayGoals);
    }
}
