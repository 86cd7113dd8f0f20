package com.tony.matchPredictor.config;

import com.tony.matchPredictor.model.ABConfig;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.repository.ABConfigRepository;
import com.tony.matchPredictor.repository.ModelVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {
    private final PredictionProperties properties;
    private final ModelVersionRepository versionRepository;
    private final ABConfigRepository abConfigRepository;
    private final Clock clock;

    @Override
    public void run(String... args) {
        // On ne remplit que si la base est vide
        if (versionRepository.findByModelNameOrderByIdAsc(properties.getModelName()).isEmpty()) {
            log.info("🌱 Initialisation du registre : version de base de {}", properties.getModelName());
            Instant now = clock.instant();
            versionRepository.save(ModelVersion.builder()
                    .modelName(properties.getModelName())
                    .versionLabel("1.0.0")
                    .active(true)
                    .activatedAt(now)
                    .createdAt(now)
                    .build());
        }

        if (!abConfigRepository.existsById(ABConfig.SINGLETON_ID)) {
            abConfigRepository.save(new ABConfig(0, null));
            log.info("✅ Configuration A/B initialisée (canary désactivé)");
        }
    }
}
