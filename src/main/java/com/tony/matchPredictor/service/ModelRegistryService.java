package com.tony.matchPredictor.service;

import com.tony.matchPredictor.exception.InvalidSignalException;
import com.tony.matchPredictor.exception.ModelNotFoundException;
import com.tony.matchPredictor.model.ABConfig;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.model.dto.RegisterModelRequest;
import com.tony.matchPredictor.repository.ABConfigRepository;
import com.tony.matchPredictor.repository.ModelVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Registre des versions de modèle et de la politique canary.
 * Seules la promotion et le rollback modifient le flag is_active.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelRegistryService {

    private final ModelVersionRepository versionRepository;
    private final ABConfigRepository abConfigRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ModelVersion getActive(String modelName) {
        return versionRepository.findByModelNameAndActiveTrue(modelName)
                .orElseThrow(() -> new ModelNotFoundException("Aucune version active pour le modèle " + modelName));
    }

    @Transactional(readOnly = true)
    public ModelVersion getVersion(Long versionId) {
        return versionRepository.findById(versionId)
                .orElseThrow(() -> new ModelNotFoundException("Version de modèle inconnue : " + versionId));
    }

    @Transactional(readOnly = true)
    public List<ModelVersion> listVersions(String modelName) {
        List<ModelVersion> versions = versionRepository.findByModelNameOrderByIdAsc(modelName);
        if (versions.isEmpty()) {
            throw new ModelNotFoundException("Modèle inconnu : " + modelName);
        }
        return versions;
    }

    /**
     * Enregistre une nouvelle version, toujours inactive.
     */
    @Transactional
    public ModelVersion register(RegisterModelRequest request) {
        if (versionRepository.existsByModelNameAndVersionLabel(request.getModelName(), request.getVersionLabel())) {
            throw new InvalidSignalException("Version déjà enregistrée : " + request.getModelName() + ":" + request.getVersionLabel());
        }

        ModelVersion.ModelVersionBuilder builder = ModelVersion.builder()
                .modelName(request.getModelName())
                .versionLabel(request.getVersionLabel())
                .trainedOn(request.getTrainedOn())
                .accuracy(request.getAccuracy())
                .logLoss(request.getLogLoss())
                .brierScore(request.getBrierScore())
                .active(false)
                .createdAt(clock.instant());
        // Paramètres optionnels : sinon valeurs par défaut de l'entité
        if (request.getRho() != null) builder.rho(request.getRho());
        if (request.getHomeAdvantage() != null) builder.homeAdvantage(request.getHomeAdvantage());
        if (request.getEloWeight() != null) builder.eloWeight(request.getEloWeight());
        if (request.getRefereeBiasWeight() != null) builder.refereeBiasWeight(request.getRefereeBiasWeight());

        ModelVersion saved = versionRepository.save(builder.build());
        log.info("📝 Nouvelle version enregistrée : {} (id={})", saved.label(), saved.getId());
        return saved;
    }

    /**
     * Bascule atomique du flag actif : toutes les versions du modèle sont verrouillées dans la même transaction,
     * deux promotions concurrentes s'exécutent donc l'une après l'autre (la dernière gagne).
     */
    @Transactional
    public ModelVersion promote(Long versionId) {
        ModelVersion target = versionRepository.findById(versionId)
                .orElseThrow(() -> new ModelNotFoundException("Version de modèle inconnue : " + versionId));

        List<ModelVersion> versions = versionRepository.lockAllByModelName(target.getModelName());
        Instant now = clock.instant();
        ModelVersion promoted = null;
        for (ModelVersion v : versions) {
            if (v.getId().equals(versionId)) {
                if (!v.isActive()) {
                    v.setActive(true);
                    v.setActivatedAt(now);
                }
                promoted = v;
            } else if (v.isActive()) {
                v.setActive(false);
                log.info("   -> {} désactivée", v.label());
            }
        }
        if (promoted == null) {
            throw new ModelNotFoundException("Version de modèle inconnue : " + versionId);
        }

        // La version promue ne peut plus servir de canary
        abConfigRepository.findById(ABConfig.SINGLETON_ID)
                .filter(cfg -> versionId.equals(cfg.getCanaryVersionId()))
                .ifPresent(cfg -> {
                    cfg.setCanaryVersionId(null);
                    cfg.setUpdatedAt(now);
                    log.info("   -> Canary retiré (version promue)");
                });

        log.info("🚀 Promotion : {} est désormais la version active", promoted.label());
        return promoted;
    }

    /**
     * Réactive la version qui était active avant la version courante.
     */
    @Transactional
    public ModelVersion rollback(String modelName) {
        List<ModelVersion> versions = versionRepository.lockAllByModelName(modelName);
        if (versions.isEmpty()) {
            throw new ModelNotFoundException("Modèle inconnu : " + modelName);
        }
        ModelVersion previous = versions.stream()
                .filter(v -> !v.isActive() && v.getActivatedAt() != null)
                .max(Comparator.comparing(ModelVersion::getActivatedAt))
                .orElseThrow(() -> new ModelNotFoundException("Aucune version antérieure pour " + modelName));

        log.info("⏪ Rollback du modèle {} vers {}", modelName, previous.label());
        return promote(previous.getId());
    }

    /**
     * Canary effectivement servi : configuré, distinct de la version active et du même modèle.
     */
    public Optional<ModelVersion> resolveCanary(ABConfig config, ModelVersion active) {
        if (!config.hasCanary() || config.getCanaryVersionId().equals(active.getId())) {
            return Optional.empty();
        }
        ModelVersion canary = getVersion(config.getCanaryVersionId());
        if (!canary.getModelName().equals(active.getModelName())) {
            log.warn("⚠️ Canary {} ignoré : il n'appartient pas au modèle {}", canary.label(), active.getModelName());
            return Optional.empty();
        }
        return Optional.of(canary);
    }

    /**
     * Versions qui reçoivent du trafic : l'active, puis le canary s'il est servi.
     */
    public List<ModelVersion> servedVersions(String modelName) {
        ModelVersion active = getActive(modelName);
        List<ModelVersion> versions = new ArrayList<>();
        versions.add(active);
        resolveCanary(getAbConfig(), active).ifPresent(versions::add);
        return versions;
    }

    /**
     * Configuration canary courante (créée à 0 % sans canary si absente).
     */
    @Transactional
    public ABConfig getAbConfig() {
        return abConfigRepository.findById(ABConfig.SINGLETON_ID)
                .orElseGet(() -> abConfigRepository.save(new ABConfig(0, null)));
    }

    @Transactional
    public ABConfig configureCanary(int canaryPercentage, Long canaryVersionId) {
        if (canaryPercentage < 0 || canaryPercentage > 100) {
            throw new InvalidSignalException("Pourcentage canary hors [0, 100] : " + canaryPercentage);
        }
        if (canaryVersionId != null) {
            ModelVersion canary = getVersion(canaryVersionId);
            if (canary.isActive()) {
                throw new InvalidSignalException("La version active ne peut pas être canary : " + canary.label());
            }
        }

        ABConfig config = getAbConfig();
        config.setCanaryPercentage(canaryPercentage);
        config.setCanaryVersionId(canaryVersionId);
        config.setUpdatedAt(clock.instant());
        ABConfig saved = abConfigRepository.save(config);
        log.info("🎯 Canary configuré : {}% -> version {}", canaryPercentage, canaryVersionId);
        return saved;
    }
}
