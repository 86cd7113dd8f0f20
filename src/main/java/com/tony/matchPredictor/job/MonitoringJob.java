package com.tony.matchPredictor.job;

import com.tony.matchPredictor.config.PredictionProperties;
import com.tony.matchPredictor.model.ArbitrageOpportunity;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.service.ArbitrageScannerService;
import com.tony.matchPredictor.service.CalibrationService;
import com.tony.matchPredictor.service.ModelRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringJob {

    private final PredictionProperties properties;
    private final ModelRegistryService registryService;
    private final CalibrationService calibrationService;
    private final ArbitrageScannerService arbitrageScanner;
    private final Clock clock;

    /**
     * JOB 1 : Agrégats de calibration du jour + gate, pour la version active et le canary.
     * Fréquence : toutes les 15 minutes.
     */
    @Scheduled(cron = "${prediction.calibration.cron:0 */15 * * * *}")
    public void refreshCalibration() {
        log.info("⏰ [CRON] Recalcul des métriques de calibration...");
        try {
            LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
            for (ModelVersion version : registryService.servedVersions(properties.getModelName())) {
                // La veille aussi : un match réglé tard peut encore y être rattaché
                calibrationService.recomputeDay(version.getId(), today.minusDays(1));
                calibrationService.recomputeDay(version.getId(), today);
                calibrationService.checkGate(version.getId())
                        .ifPresent(alert -> log.warn("   -> Alerte calibration : {}", alert));
            }
            log.info("✅ [CRON] Métriques de calibration à jour.");
        } catch (Exception e) {
            log.error("❌ [CRON] Echec du recalcul de calibration", e);
        }
    }

    /**
     * JOB 2 : Scan des surebets sur les cotes récentes.
     */
    @Scheduled(fixedDelayString = "${prediction.arbitrage.scan-interval-ms:30000}")
    public void scanArbitrage() {
        try {
            List<ArbitrageOpportunity> found = arbitrageScanner.scanAndRecord();
            if (!found.isEmpty()) {
                log.info("✅ [CRON] {} opportunité(s) d'arbitrage enregistrée(s)", found.size());
            }
        } catch (Exception e) {
            log.error("❌ [CRON] Echec du scan d'arbitrage", e);
        }
    }
}
