package com.tony.matchPredictor.service;

import com.tony.matchPredictor.config.PredictionProperties;
import com.tony.matchPredictor.exception.InsufficientInputException;
import com.tony.matchPredictor.exception.ModelNotFoundException;
import com.tony.matchPredictor.model.CalibrationEvent;
import com.tony.matchPredictor.model.FixtureSignals;
import com.tony.matchPredictor.model.MarketProbability;
import com.tony.matchPredictor.model.MatchOutcome;
import com.tony.matchPredictor.model.ModelMetricsDaily;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.model.dto.CalibrationAlert;
import com.tony.matchPredictor.model.dto.ReliabilityBin;
import com.tony.matchPredictor.repository.CalibrationEventRepository;
import com.tony.matchPredictor.repository.FixtureSignalsRepository;
import com.tony.matchPredictor.repository.ModelMetricsDailyRepository;
import com.tony.matchPredictor.repository.ModelVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Suivi de calibration : événements réglés -> agrégats journaliers (Brier, précision, ECE) -> gate.
 * Le gate ne fait que signaler : aucune promotion ni rollback automatique.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalibrationService {

    private final PredictionProperties properties;
    private final CalibrationEventRepository eventRepository;
    private final ModelMetricsDailyRepository metricsRepository;
    private final ModelVersionRepository versionRepository;
    private final FixtureSignalsRepository signalsRepository;
    private final ModelRegistryService registryService;
    private final ProbabilityModelService modelService;
    private final ServingMetrics metrics;
    private final Clock clock;

    /**
     * Règle un match : une prédiction 1X2 par version servie (active et canary), confrontée au score final.
     *
     * @return événements créés (vide si déjà réglé)
     */
    public List<CalibrationEvent> settleFixture(Long fixtureId, int homeGoals, int awayGoals) {
        FixtureSignals signals = signalsRepository.findById(fixtureId)
                .orElseThrow(() -> new InsufficientInputException("Aucun signal pour le match " + fixtureId));
        MatchOutcome outcome = MatchOutcome.fromScore(homeGoals, awayGoals);

        List<ModelVersion> versions = registryService.servedVersions(properties.getModelName());

        List<CalibrationEvent> created = new ArrayList<>();
        for (ModelVersion version : versions) {
            if (eventRepository.existsByFixtureIdAndModelVersionId(fixtureId, version.getId())) {
                continue;
            }
            // Recalcul déterministe : identique à ce qui a été servi pour ces signaux
            MarketProbability prediction = modelService.compute(signals, version);
            CalibrationEvent event = CalibrationEvent.builder()
                    .fixtureId(fixtureId)
                    .modelVersionId(version.getId())
                    .pHome(prediction.probabilityOf("1X2_H"))
                    .pDraw(prediction.probabilityOf("1X2_D"))
                    .pAway(prediction.probabilityOf("1X2_A"))
                    .outcome(outcome)
                    .createdAt(clock.instant())
                    .build();
            recordEvent(event).ifPresent(created::add);
        }

        for (CalibrationEvent event : created) {
            recomputeDay(event.getModelVersionId(), dayOf(event.getCreatedAt()));
        }
        log.info("🏁 Match {} réglé ({}-{}, {}) : {} événement(s) de calibration", fixtureId, homeGoals, awayGoals, outcome, created.size());
        return created;
    }

    /**
     * Insertion si absent : un second événement pour le même (match, version) est ignoré.
     */
    public Optional<CalibrationEvent> recordEvent(CalibrationEvent event) {
        if (eventRepository.existsByFixtureIdAndModelVersionId(event.getFixtureId(), event.getModelVersionId())) {
            return Optional.empty();
        }
        try {
            return Optional.of(eventRepository.saveAndFlush(event));
        } catch (DataIntegrityViolationException e) {
            log.debug("Événement déjà enregistré pour match {} / version {}", event.getFixtureId(), event.getModelVersionId());
            return Optional.empty();
        }
    }

    /**
     * Recalcule entièrement l'agrégat d'une journée à partir des événements (jamais incrémental).
     */
    @Transactional
    public ModelMetricsDaily recomputeDay(Long versionId, LocalDate day) {
        List<CalibrationEvent> dayEvents = eventRepository.findInWindow(versionId, startOf(day), startOf(day.plusDays(1)));

        int served = dayEvents.size();
        int correct = 0;
        double brierSum = 0.0;
        for (CalibrationEvent e : dayEvents) {
            brierSum += e.brierScore();
            if (e.predictedOutcome() == e.getOutcome()) correct++;
        }

        int eceDays = Math.max(1, properties.getCalibration().getEceWindowDays());
        List<CalibrationEvent> eceEvents = eceDays == 1
                ? dayEvents
                : eventRepository.findInWindow(versionId, startOf(day.minusDays(eceDays - 1L)), startOf(day.plusDays(1)));
        Double ece = eceEvents.isEmpty() ? null : expectedCalibrationError(eceEvents, properties.getCalibration().getBins());

        ModelMetricsDaily row = metricsRepository.findByModelVersionIdAndDay(versionId, day)
                .orElseGet(() -> ModelMetricsDaily.builder().modelVersionId(versionId).day(day).build());
        row.setServedCount(served);
        row.setCorrectCount(correct);
        row.setBrierSum(brierSum);
        row.setEce(ece);
        row.setComputedAt(clock.instant());
        return metricsRepository.save(row);
    }

    /**
     * Gate de déploiement : précision glissante sous le plancher ou dernière ECE au-dessus du plafond.
     *
     * @return l'alerte si l'un des seuils est franchi, vide sinon
     */
    @Transactional(readOnly = true)
    public Optional<CalibrationAlert> checkGate(Long versionId) {
        ModelVersion version = registryService.getVersion(versionId);
        PredictionProperties.Calibration cfg = properties.getCalibration();

        LocalDate today = dayOf(clock.instant());
        List<ModelMetricsDaily> window = metricsRepository.findByModelVersionIdAndDayBetweenOrderByDayAsc(
                versionId, today.minusDays(cfg.getWindowDays() - 1L), today);
        int served = window.stream().mapToInt(ModelMetricsDaily::getServedCount).sum();
        int correct = window.stream().mapToInt(ModelMetricsDaily::getCorrectCount).sum();
        double accuracy = served == 0 ? 0.0 : (double) correct / served;

        Double latestEce = metricsRepository.findFirstByModelVersionIdAndEceIsNotNullOrderByDayDesc(versionId)
                .map(ModelMetricsDaily::getEce)
                .orElse(null);

        boolean accuracyBreached = served > 0 && accuracy < cfg.getAccuracyFloor();
        boolean eceBreached = latestEce != null && latestEce > cfg.getEceCeil();
        if (!accuracyBreached && !eceBreached) {
            return Optional.empty();
        }

        metrics.recordCalibrationGateBreached();
        log.warn("🚨 Gate de calibration franchi pour {} : précision {} (plancher {}), ECE {} (plafond {})",
                version.label(), accuracy, cfg.getAccuracyFloor(), latestEce, cfg.getEceCeil());
        return Optional.of(new CalibrationAlert(versionId, version.label(), accuracy, latestEce,
                accuracyBreached, eceBreached, clock.instant()));
    }

    @Transactional(readOnly = true)
    public List<ModelMetricsDaily> getDailyCalibration(Long versionId, LocalDate from, LocalDate to) {
        if (!versionRepository.existsById(versionId)) {
            throw new ModelNotFoundException("Version de modèle inconnue : " + versionId);
        }
        return metricsRepository.findByModelVersionIdAndDayBetweenOrderByDayAsc(versionId, from, to);
    }

    /**
     * Diagramme de fiabilité : par tranche de probabilité prédite, fréquence réellement observée.
     */
    @Transactional(readOnly = true)
    public List<ReliabilityBin> reliabilityReport(Long versionId, LocalDate from, LocalDate to) {
        if (!versionRepository.existsById(versionId)) {
            throw new ModelNotFoundException("Version de modèle inconnue : " + versionId);
        }
        List<CalibrationEvent> events = eventRepository.findInWindow(versionId, startOf(from), startOf(to.plusDays(1)));
        int bins = properties.getCalibration().getBins();
        BinAccumulator acc = accumulate(events, bins);

        List<ReliabilityBin> report = new ArrayList<>();
        for (int b = 0; b < bins; b++) {
            long n = acc.counts[b];
            report.add(new ReliabilityBin(
                    (double) b / bins,
                    (double) (b + 1) / bins,
                    n,
                    n == 0 ? 0.0 : acc.sumPredicted[b] / n,
                    n == 0 ? 0.0 : acc.sumObserved[b] / n));
        }
        return report;
    }

    /**
     * ECE sur les trois probabilités de classe : Σ (n_b / N) * |moyenne prédite - fréquence observée|.
     */
    static double expectedCalibrationError(List<CalibrationEvent> events, int bins) {
        BinAccumulator acc = accumulate(events, bins);
        long total = 0;
        for (long c : acc.counts) total += c;
        if (total == 0) return 0.0;

        double ece = 0.0;
        for (int b = 0; b < bins; b++) {
            if (acc.counts[b] == 0) continue;
            double meanPredicted = acc.sumPredicted[b] / acc.counts[b];
            double observed = acc.sumObserved[b] / acc.counts[b];
            ece += ((double) acc.counts[b] / total) * Math.abs(meanPredicted - observed);
        }
        return ece;
    }

    private static BinAccumulator accumulate(List<CalibrationEvent> events, int bins) {
        BinAccumulator acc = new BinAccumulator(bins);
        for (CalibrationEvent e : events) {
            for (MatchOutcome o : MatchOutcome.values()) {
                double p = e.probabilityOf(o);
                int b = Math.min((int) (p * bins), bins - 1);
                acc.counts[b]++;
                acc.sumPredicted[b] += p;
                acc.sumObserved[b] += (o == e.getOutcome()) ? 1.0 : 0.0;
            }
        }
        return acc;
    }

    private static final class BinAccumulator {
        final long[] counts;
        final double[] sumPredicted;
        final double[] sumObserved;

        BinAccumulator(int bins) {
            counts = new long[bins];
            sumPredicted = new double[bins];
            sumObserved = new double[bins];
        }
    }

    private static Instant startOf(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static LocalDate dayOf(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }
}
