package com.tony.matchPredictor.service;

import com.tony.matchPredictor.model.MarketDefinition;
import com.tony.matchPredictor.model.MarketDefinition.ScorePredicate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue déclaratif des marchés : chaque marché est un prédicat sur le score final.
 * Ajouter un marché = ajouter une ligne ici, le modèle ne change pas.
 * <p>
 * Chaque groupe non nul forme une partition exclusive et exhaustive des scores
 * (la somme de ses probabilités vaut 1).
 */
@Component
public class MarketCatalog {

    public static final String GROUP_1X2 = "1X2";

    private static final int MAX_TOTAL_LINE = 6;     // Over/Under 0.5 à 6.5
    private static final int MAX_TEAM_LINE = 2;      // Over/Under équipe 0.5 à 2.5
    private static final int MAX_EXACT_SCORE = 5;    // Score exact 0-0 à 5-5, puis "Autre"
    private static final int MAX_EXACT_TOTAL = 6;    // Total exact 0 à 5, puis 6+

    private final List<MarketDefinition> markets;
    private final Map<String, MarketDefinition> byCode;
    private final Map<String, List<MarketDefinition>> byGroup;

    public MarketCatalog() {
        List<MarketDefinition> list = new ArrayList<>();

        // --- 1X2 & Double chance ---
        list.add(market("1X2_H", GROUP_1X2, "H", (h, a) -> h > a));
        list.add(market("1X2_D", GROUP_1X2, "D", (h, a) -> h == a));
        list.add(market("1X2_A", GROUP_1X2, "A", (h, a) -> h < a));
        list.add(market("DC_1X", null, "1X", (h, a) -> h >= a));
        list.add(market("DC_12", null, "12", (h, a) -> h != a));
        list.add(market("DC_X2", null, "X2", (h, a) -> h <= a));

        // --- Over / Under total ---
        for (int k = 0; k <= MAX_TOTAL_LINE; k++) {
            final int line = k;
            String group = "OU_" + line + "_5";
            list.add(market(group + "_OVER", group, "OVER", (h, a) -> h + a > line));
            list.add(market(group + "_UNDER", group, "UNDER", (h, a) -> h + a <= line));
        }

        // --- Over / Under par équipe ---
        for (int k = 0; k <= MAX_TEAM_LINE; k++) {
            final int line = k;
            String home = "HOME_OU_" + line + "_5";
            String away = "AWAY_OU_" + line + "_5";
            list.add(market(home + "_OVER", home, "OVER", (h, a) -> h > line));
            list.add(market(home + "_UNDER", home, "UNDER", (h, a) -> h <= line));
            list.add(market(away + "_OVER", away, "OVER", (h, a) -> a > line));
            list.add(market(away + "_UNDER", away, "UNDER", (h, a) -> a <= line));
        }

        // --- Les deux équipes marquent ---
        list.add(market("BTTS_YES", "BTTS", "YES", (h, a) -> h > 0 && a > 0));
        list.add(market("BTTS_NO", "BTTS", "NO", (h, a) -> h == 0 || a == 0));

        // --- Score exact ---
        for (int i = 0; i <= MAX_EXACT_SCORE; i++) {
            for (int j = 0; j <= MAX_EXACT_SCORE; j++) {
                final int home = i;
                final int away = j;
                list.add(market("CS_" + home + "_" + away, "CS", home + "-" + away, (h, a) -> h == home && a == away));
            }
        }
        list.add(market("CS_OTHER", "CS", "OTHER", (h, a) -> h > MAX_EXACT_SCORE || a > MAX_EXACT_SCORE));

        // --- Nombre exact de buts ---
        for (int t = 0; t < MAX_EXACT_TOTAL; t++) {
            final int total = t;
            list.add(market("TG_" + total, "TG", String.valueOf(total), (h, a) -> h + a == total));
        }
        list.add(market("TG_" + MAX_EXACT_TOTAL + "_PLUS", "TG", MAX_EXACT_TOTAL + "+", (h, a) -> h + a >= MAX_EXACT_TOTAL));

        // --- Pair / Impair ---
        list.add(market("OE_ODD", "OE", "ODD", (h, a) -> (h + a) % 2 == 1));
        list.add(market("OE_EVEN", "OE", "EVEN", (h, a) -> (h + a) % 2 == 0));

        // --- Écart final ---
        list.add(market("WM_HOME_1", "WM", "HOME_1", (h, a) -> h - a == 1));
        list.add(market("WM_HOME_2", "WM", "HOME_2", (h, a) -> h - a == 2));
        list.add(market("WM_HOME_3_PLUS", "WM", "HOME_3+", (h, a) -> h - a >= 3));
        list.add(market("WM_DRAW", "WM", "DRAW", (h, a) -> h == a));
        list.add(market("WM_AWAY_1", "WM", "AWAY_1", (h, a) -> a - h == 1));
        list.add(market("WM_AWAY_2", "WM", "AWAY_2", (h, a) -> a - h == 2));
        list.add(market("WM_AWAY_3_PLUS", "WM", "AWAY_3+", (h, a) -> a - h >= 3));

        // --- Clean sheet & victoire sans encaisser ---
        list.add(market("CLEAN_SHEET_HOME_YES", "CLEAN_SHEET_HOME", "YES", (h, a) -> a == 0));
        list.add(market("CLEAN_SHEET_HOME_NO", "CLEAN_SHEET_HOME", "NO", (h, a) -> a > 0));
        list.add(market("CLEAN_SHEET_AWAY_YES", "CLEAN_SHEET_AWAY", "YES", (h, a) -> h == 0));
        list.add(market("CLEAN_SHEET_AWAY_NO", "CLEAN_SHEET_AWAY", "NO", (h, a) -> h > 0));
        list.add(market("WTN_HOME_YES", "WTN_HOME", "YES", (h, a) -> h > 0 && a == 0));
        list.add(market("WTN_HOME_NO", "WTN_HOME", "NO", (h, a) -> h == 0 || a > 0));
        list.add(market("WTN_AWAY_YES", "WTN_AWAY", "YES", (h, a) -> a > 0 && h == 0));
        list.add(market("WTN_AWAY_NO", "WTN_AWAY", "NO", (h, a) -> a == 0 || h > 0));

        // --- Handicap européen (3 issues) ---
        addHandicap(list, "EH_HOME_M1", -1);
        addHandicap(list, "EH_HOME_P1", 1);

        // --- Combinés ---
        for (String res : List.of("H", "D", "A")) {
            ScorePredicate result = resultPredicate(res);
            list.add(market("1X2_BTTS_" + res + "_YES", "1X2_BTTS", res + "_YES",
                    (h, a) -> result.test(h, a) && h > 0 && a > 0));
            list.add(market("1X2_BTTS_" + res + "_NO", "1X2_BTTS", res + "_NO",
                    (h, a) -> result.test(h, a) && (h == 0 || a == 0)));
            list.add(market("1X2_OU_2_5_" + res + "_OVER", "1X2_OU_2_5", res + "_OVER",
                    (h, a) -> result.test(h, a) && h + a > 2));
            list.add(market("1X2_OU_2_5_" + res + "_UNDER", "1X2_OU_2_5", res + "_UNDER",
                    (h, a) -> result.test(h, a) && h + a <= 2));
        }

        this.markets = Collections.unmodifiableList(list);

        Map<String, MarketDefinition> codes = new LinkedHashMap<>();
        Map<String, List<MarketDefinition>> groups = new LinkedHashMap<>();
        for (MarketDefinition def : list) {
            if (codes.put(def.code(), def) != null) {
                throw new IllegalStateException("Code marché dupliqué : " + def.code());
            }
            if (def.group() != null) {
                groups.computeIfAbsent(def.group(), g -> new ArrayList<>()).add(def);
            }
        }
        this.byCode = Collections.unmodifiableMap(codes);
        this.byGroup = Collections.unmodifiableMap(groups);
    }

    public List<MarketDefinition> all() {
        return markets;
    }

    public Optional<MarketDefinition> find(String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    /** Groupes exclusifs, dans l'ordre du catalogue. */
    public Map<String, List<MarketDefinition>> groups() {
        return byGroup;
    }

    /** Issues connues d'un groupe (vide si le groupe n'est pas au catalogue). */
    public List<String> outcomesFor(String group) {
        List<MarketDefinition> defs = byGroup.get(group);
        if (defs == null) return List.of();
        return defs.stream().map(MarketDefinition::outcome).toList();
    }

    private static void addHandicap(List<MarketDefinition> list, String group, int handicap) {
        list.add(market(group + "_H", group, "H", (h, a) -> h + handicap > a));
        list.add(market(group + "_D", group, "D", (h, a) -> h + handicap == a));
        list.add(market(group + "_A", group, "A", (h, a) -> h + handicap < a));
    }

    private static ScorePredicate resultPredicate(String result) {
        return switch (result) {
            case "H" -> (h, a) -> h > a;
            case "D" -> (h, a) -> h == a;
            default -> (h, a) -> h < a;
        };
    }

    private static MarketDefinition market(String code, String group, String outcome, ScorePredicate predicate) {
        return new MarketDefinition(code, group, outcome, predicate);
    }
}
