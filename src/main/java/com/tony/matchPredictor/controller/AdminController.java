package com.tony.matchPredictor.controller;

import com.tony.matchPredictor.model.ABConfig;
import com.tony.matchPredictor.model.CalibrationEvent;
import com.tony.matchPredictor.model.ModelMetricsDaily;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.model.ShadowLogEntry;
import com.tony.matchPredictor.model.dto.CalibrationAlert;
import com.tony.matchPredictor.model.dto.CanaryConfigRequest;
import com.tony.matchPredictor.model.dto.RegisterModelRequest;
import com.tony.matchPredictor.model.dto.ReliabilityBin;
import com.tony.matchPredictor.model.dto.SettlementRequest;
import com.tony.matchPredictor.repository.ShadowLogRepository;
import com.tony.matchPredictor.service.CalibrationService;
import com.tony.matchPredictor.service.ModelRegistryService;
import com.tony.matchPredictor.service.TrafficSplitterService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {
    private final ModelRegistryService registryService;
    private final TrafficSplitterService trafficSplitter;
    private final CalibrationService calibrationService;
    private final ShadowLogRepository shadowLogRepository;

    // --- Registre des modèles ---

    @PostMapping("/models")
    public ResponseEntity<ModelVersion> registerModel(@Valid @RequestBody RegisterModelRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registryService.register(request));
    }

    @PostMapping("/models/{versionId}/promote")
    public ResponseEntity<ModelVersion> promote(@PathVariable Long versionId) {
        log.info("Demande de promotion de la version {}", versionId);
        return ResponseEntity.ok(registryService.promote(versionId));
    }

    @PostMapping("/models/{modelName}/rollback")
    public ResponseEntity<ModelVersion> rollback(@PathVariable String modelName) {
        return ResponseEntity.ok(registryService.rollback(modelName));
    }

    @GetMapping("/models/{modelName}/active")
    public ResponseEntity<ModelVersion> getActive(@PathVariable String modelName) {
        return ResponseEntity.ok(registryService.getActive(modelName));
    }

    @GetMapping("/models/{modelName}")
    public ResponseEntity<List<ModelVersion>> listVersions(@PathVariable String modelName) {
        return ResponseEntity.ok(registryService.listVersions(modelName));
    }

    // --- Canary & A/B ---

    @GetMapping("/ab-config")
    public ResponseEntity<ABConfig> getAbConfig() {
        return ResponseEntity.ok(registryService.getAbConfig());
    }

    @PutMapping("/ab-config")
    public ResponseEntity<ABConfig> configureCanary(@Valid @RequestBody CanaryConfigRequest request) {
        return ResponseEntity.ok(registryService.configureCanary(request.getCanaryPercentage(), request.getCanaryVersionId()));
    }

    @DeleteMapping("/ab-assignments/{deviceId}")
    public ResponseEntity<Void> clearAssignment(@PathVariable String deviceId) {
        trafficSplitter.clearAssignment(deviceId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/ab-assignments")
    public ResponseEntity<Void> clearAllAssignments() {
        trafficSplitter.clearAllAssignments();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/shadow/{fixtureId}")
    public ResponseEntity<List<ShadowLogEntry>> getShadowLog(@PathVariable Long fixtureId) {
        return ResponseEntity.ok(shadowLogRepository.findByFixtureIdOrderByCreatedAtDesc(fixtureId));
    }

    // --- Calibration ---

    @PostMapping("/fixtures/{fixtureId}/settle")
    public ResponseEntity<List<CalibrationEvent>> settleFixture(@PathVariable Long fixtureId,
                                                                @Valid @RequestBody SettlementRequest request) {
        return ResponseEntity.ok(calibrationService.settleFixture(fixtureId, request.getHomeGoals(), request.getAwayGoals()));
    }

    @GetMapping("/calibration/{versionId}")
    public ResponseEntity<List<ModelMetricsDaily>> getDailyCalibration(
            @PathVariable Long versionId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(calibrationService.getDailyCalibration(versionId, from, to));
    }

    @GetMapping("/calibration/{versionId}/reliability")
    public ResponseEntity<List<ReliabilityBin>> getReliability(
            @PathVariable Long versionId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(calibrationService.reliabilityReport(versionId, from, to));
    }

    // 204 = aucun seuil franchi
    @GetMapping("/calibration/{versionId}/gate")
    public ResponseEntity<CalibrationAlert> checkGate(@PathVariable Long versionId) {
        return calibrationService.checkGate(versionId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }
}
