package com.tony.matchPredictor.service;

import com.tony.matchPredictor.config.PredictionProperties;
import com.tony.matchPredictor.exception.InsufficientInputException;
import com.tony.matchPredictor.model.ArbitrageLeg;
import com.tony.matchPredictor.model.ArbitrageOpportunity;
import com.tony.matchPredictor.model.BookmakerOddsQuote;
import com.tony.matchPredictor.model.dto.OddsComparison;
import com.tony.matchPredictor.repository.ArbitrageOpportunityRepository;
import com.tony.matchPredictor.repository.BookmakerOddsQuoteRepository;
import com.tony.matchPredictor.utils.ArbitrageCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Détection des surebets entre bookmakers, indépendante des services de prédiction.
 * Une cote plus vieille que le seuil de fraîcheur est écartée, jamais moyennée avec des cotes récentes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArbitrageScannerService {

    private final PredictionProperties properties;
    private final BookmakerOddsQuoteRepository quoteRepository;
    private final ArbitrageOpportunityRepository opportunityRepository;
    private final MarketCatalog catalog;
    private final ServingMetrics metrics;
    private final Clock clock;

    // Horodatage vu par cote (bookmaker, issue) de chaque (match, marché) lors du scan planifié
    private final Map<MarketKey, Map<String, Instant>> lastSeen = new ConcurrentHashMap<>();

    record MarketKey(Long fixtureId, String marketCode) {
    }

    /**
     * Opportunités courantes (non enregistrées), pour un match ou pour tous.
     */
    public List<ArbitrageOpportunity> findOpportunities(Long fixtureId) {
        Instant now = clock.instant();
        List<BookmakerOddsQuote> quotes = fixtureId != null
                ? quoteRepository.findByFixtureId(fixtureId)
                : quoteRepository.findByQuotedAtAfter(now.minus(scanWindow()));

        List<ArbitrageOpportunity> result = new ArrayList<>();
        groupByMarket(quotes).forEach((key, marketQuotes) ->
                detect(key, marketQuotes, now).ifPresent(result::add));
        result.sort(Comparator.comparing(ArbitrageOpportunity::getProfitPercentage).reversed());
        return result;
    }

    /**
     * Scan planifié : ne réévalue que les marchés dont une cote a avancé depuis le dernier passage,
     * et enregistre les opportunités trouvées.
     */
    public List<ArbitrageOpportunity> scanAndRecord() {
        Instant now = clock.instant();
        Instant since = now.minus(scanWindow());
        List<BookmakerOddsQuote> quotes = quoteRepository.findByQuotedAtAfter(since);

        List<ArbitrageOpportunity> recorded = new ArrayList<>();
        int evaluated = 0;
        for (Map.Entry<MarketKey, List<BookmakerOddsQuote>> group : groupByMarket(quotes).entrySet()) {
            Map<String, Instant> current = quoteTimestamps(group.getValue());
            Map<String, Instant> previous = lastSeen.get(group.getKey());
            if (previous != null && !hasAdvanced(previous, current)) {
                continue;
            }
            lastSeen.put(group.getKey(), current);
            evaluated++;

            detect(group.getKey(), group.getValue(), now).ifPresent(opportunity -> {
                recorded.add(opportunityRepository.save(opportunity));
                metrics.recordArbitrageDetected();
                log.info("💰 Surebet match {} / {} : +{}% ({})", opportunity.getFixtureId(), opportunity.getMarketCode(),
                        opportunity.getProfitPercentage(), describeLegs(opportunity));
            });
        }

        // Les marchés sortis de la fenêtre n'ont plus besoin d'être suivis
        lastSeen.entrySet().removeIf(e -> e.getValue().values().stream().allMatch(t -> t.isBefore(since)));
        log.debug("Scan arbitrage : {} marchés réévalués, {} opportunités", evaluated, recorded.size());
        return recorded;
    }

    public List<ArbitrageOpportunity> history(int days) {
        Instant since = clock.instant().minus(Duration.ofDays(Math.max(days, 0)));
        return opportunityRepository.findByDetectedAtAfterOrderByDetectedAtDesc(since);
    }

    /**
     * Comparatif des cotes fraîches d'un marché : meilleure, pire, moyenne par issue, et marge globale.
     */
    public OddsComparison compareOdds(Long fixtureId, String marketCode) {
        Instant now = clock.instant();
        List<BookmakerOddsQuote> fresh = excludeStale(quoteRepository.findByFixtureIdAndMarketCode(fixtureId, marketCode), now);
        if (fresh.isEmpty()) {
            throw new InsufficientInputException("Aucune cote fraîche pour le match " + fixtureId + " / " + marketCode);
        }

        Map<String, List<BookmakerOddsQuote>> byOutcome = byOutcome(marketCode, fresh);
        List<OddsComparison.OutcomeOdds> outcomes = new ArrayList<>();
        List<BigDecimal> bestOdds = new ArrayList<>();
        byOutcome.forEach((outcome, list) -> {
            BookmakerOddsQuote best = best(list);
            BigDecimal worst = list.stream().map(BookmakerOddsQuote::getOdds).min(Comparator.naturalOrder()).orElse(best.getOdds());
            BigDecimal total = list.stream().map(BookmakerOddsQuote::getOdds).reduce(BigDecimal.ZERO, BigDecimal::add);
            bestOdds.add(best.getOdds());
            outcomes.add(OddsComparison.OutcomeOdds.builder()
                    .outcome(outcome)
                    .bestOdds(best.getOdds())
                    .bestBookmaker(best.getBookmaker())
                    .worstOdds(worst)
                    .averageOdds(total.divide(BigDecimal.valueOf(list.size()), 3, RoundingMode.HALF_EVEN))
                    .bookmakerCount(list.size())
                    .build());
        });

        BigDecimal sum = ArbitrageCalculator.impliedProbabilitySum(bestOdds);
        return OddsComparison.builder()
                .fixtureId(fixtureId)
                .marketCode(marketCode)
                .outcomes(outcomes)
                .bestOddsMarginPct(ArbitrageCalculator.marginPercentage(sum).setScale(4, RoundingMode.HALF_EVEN))
                .build();
    }

    Optional<ArbitrageOpportunity> detect(MarketKey key, List<BookmakerOddsQuote> quotes, Instant now) {
        // Issues attendues : celles du catalogue, sinon toutes celles vues (même périmées)
        List<String> expected = catalog.outcomesFor(key.marketCode());
        if (expected.isEmpty()) {
            expected = quotes.stream().map(BookmakerOddsQuote::getOutcome).distinct().sorted().toList();
        }
        if (expected.size() < 2) {
            return Optional.empty();
        }

        Map<String, List<BookmakerOddsQuote>> freshByOutcome = byOutcome(key.marketCode(), excludeStale(quotes, now));
        List<ArbitrageLeg> legs = new ArrayList<>();
        List<BigDecimal> bestOdds = new ArrayList<>();
        for (String outcome : expected) {
            List<BookmakerOddsQuote> candidates = freshByOutcome.get(outcome);
            if (candidates == null || candidates.isEmpty()) {
                log.debug("Match {} / {} : pas de cote fraîche pour l'issue {}", key.fixtureId(), key.marketCode(), outcome);
                return Optional.empty();
            }
            BookmakerOddsQuote best = best(candidates);
            bestOdds.add(best.getOdds());
            legs.add(ArbitrageLeg.builder().outcome(outcome).bookmaker(best.getBookmaker()).odds(best.getOdds()).build());
        }

        BigDecimal sum = ArbitrageCalculator.impliedProbabilitySum(bestOdds);
        if (!ArbitrageCalculator.isArbitrage(sum)) {
            return Optional.empty();
        }
        BigDecimal profit = ArbitrageCalculator.profitPercentage(sum);
        if (profit.compareTo(properties.getArbitrage().getMinProfitPct()) < 0) {
            return Optional.empty();
        }

        BigDecimal totalStake = properties.getArbitrage().getTotalStake();
        List<BigDecimal> stakes = ArbitrageCalculator.stakes(bestOdds, totalStake, sum);
        for (int i = 0; i < legs.size(); i++) {
            ArbitrageLeg leg = legs.get(i);
            leg.setStake(ArbitrageCalculator.money(stakes.get(i)));
            leg.setPayout(ArbitrageCalculator.money(stakes.get(i).multiply(leg.getOdds(), ArbitrageCalculator.MC)));
        }

        return Optional.of(ArbitrageOpportunity.builder()
                .fixtureId(key.fixtureId())
                .marketCode(key.marketCode())
                .legs(legs)
                .impliedProbabilitySum(sum.setScale(10, RoundingMode.HALF_EVEN))
                .profitPercentage(profit.setScale(4, RoundingMode.HALF_EVEN))
                .totalStake(ArbitrageCalculator.money(totalStake))
                .guaranteedPayout(ArbitrageCalculator.money(ArbitrageCalculator.guaranteedPayout(totalStake, sum)))
                .detectedAt(now)
                .build());
    }

    private List<BookmakerOddsQuote> excludeStale(List<BookmakerOddsQuote> quotes, Instant now) {
        Instant threshold = now.minus(properties.getArbitrage().getFreshness());
        List<BookmakerOddsQuote> fresh = new ArrayList<>(quotes.size());
        int stale = 0;
        for (BookmakerOddsQuote q : quotes) {
            if (q.getQuotedAt().isBefore(threshold)) {
                stale++;
            } else {
                fresh.add(q);
            }
        }
        if (stale > 0) {
            metrics.recordStaleQuotes(stale);
            log.debug("{} cote(s) périmée(s) écartée(s) (seuil {})", stale, threshold);
        }
        return fresh;
    }

    // Meilleure cote ; à égalité, ordre alphabétique du bookmaker (résultat stable)
    private static BookmakerOddsQuote best(List<BookmakerOddsQuote> quotes) {
        return quotes.stream()
                .max(Comparator.comparing(BookmakerOddsQuote::getOdds)
                        .thenComparing(BookmakerOddsQuote::getBookmaker, Comparator.reverseOrder()))
                .orElseThrow();
    }

    private Map<String, List<BookmakerOddsQuote>> byOutcome(String marketCode, List<BookmakerOddsQuote> quotes) {
        Map<String, List<BookmakerOddsQuote>> grouped = quotes.stream()
                .collect(Collectors.groupingBy(BookmakerOddsQuote::getOutcome, TreeMap::new, Collectors.toList()));
        List<String> order = catalog.outcomesFor(marketCode);
        if (order.isEmpty()) {
            return grouped;
        }
        Map<String, List<BookmakerOddsQuote>> ordered = new LinkedHashMap<>();
        order.stream().filter(grouped::containsKey).forEach(o -> ordered.put(o, grouped.get(o)));
        grouped.forEach(ordered::putIfAbsent);
        return ordered;
    }

    private static Map<MarketKey, List<BookmakerOddsQuote>> groupByMarket(List<BookmakerOddsQuote> quotes) {
        return quotes.stream().collect(Collectors.groupingBy(
                q -> new MarketKey(q.getFixtureId(), q.getMarketCode()),
                LinkedHashMap::new,
                Collectors.toList()));
    }

    private static Map<String, Instant> quoteTimestamps(List<BookmakerOddsQuote> quotes) {
        Map<String, Instant> timestamps = new HashMap<>();
        for (BookmakerOddsQuote q : quotes) {
            timestamps.merge(q.getBookmaker() + "|" + q.getOutcome(), q.getQuotedAt(),
                    (a, b) -> a.isAfter(b) ? a : b);
        }
        return timestamps;
    }

    // Vrai dès qu'une cote est nouvelle ou plus récente que lors du dernier passage
    private static boolean hasAdvanced(Map<String, Instant> previous, Map<String, Instant> current) {
        return current.entrySet().stream().anyMatch(e -> {
            Instant before = previous.get(e.getKey());
            return before == null || e.getValue().isAfter(before);
        });
    }

    private Duration scanWindow() {
        Duration lookback = properties.getArbitrage().getLookback();
        Duration freshness = properties.getArbitrage().getFreshness();
        return lookback.compareTo(freshness) >= 0 ? lookback : freshness;
    }

    private static String describeLegs(ArbitrageOpportunity opportunity) {
        return opportunity.getLegs().stream()
                .map(l -> l.getOutcome() + "@" + l.getOdds() + " chez " + l.getBookmaker() + " (mise " + l.getStake() + ")")
                .collect(Collectors.joining(", "));
    }
}
