package com.tony.matchPredictor.service;

import com.tony.matchPredictor.config.ClockConfig;
import com.tony.matchPredictor.exception.InvalidSignalException;
import com.tony.matchPredictor.exception.ModelNotFoundException;
import com.tony.matchPredictor.model.ABConfig;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.model.dto.RegisterModelRequest;
import com.tony.matchPredictor.repository.ModelVersionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({ModelRegistryService.class, ClockConfig.class})
class ModelRegistryServiceTest {

    @Autowired
    private ModelRegistryService registryService;

    @Autowired
    private ModelVersionRepository versionRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("Une version enregistrée est toujours inactive")
    void registeredVersionIsInactive() {
        ModelVersion v = registryService.register(request("1.0.0"));

        assertThat(v.getId()).isNotNull();
        assertThat(v.isActive()).isFalse();
        assertThat(v.getRho()).isEqualTo(-0.13);
    }

    @Test
    @DisplayName("Libellé de version unique par modèle")
    void duplicateVersionLabelIsRejected() {
        registryService.register(request("1.0.0"));

        assertThatThrownBy(() -> registryService.register(request("1.0.0")))
                .isInstanceOf(InvalidSignalException.class);
    }

    @Test
    @DisplayName("Promotion : exactement une version active, l'historique est conservé")
    void promotionKeepsSingleActiveVersion() {
        ModelVersion v1 = registryService.register(request("1.0.0"));
        ModelVersion v2 = registryService.register(request("1.1.0"));

        registryService.promote(v1.getId());
        registryService.promote(v2.getId());
        entityManager.flush();
        entityManager.clear();

        List<ModelVersion> versions = versionRepository.findByModelNameOrderByIdAsc("dixon-coles");
        assertThat(versions).hasSize(2);
        assertThat(versions).filteredOn(ModelVersion::isActive).extracting(ModelVersion::getVersionLabel).containsExactly("1.1.0");
        assertThat(registryService.getActive("dixon-coles").getId()).isEqualTo(v2.getId());
    }

    @Test
    @DisplayName("Rollback : la version précédemment active redevient active")
    void rollbackRestoresPreviousVersion() {
        ModelVersion v1 = registryService.register(request("1.0.0"));
        ModelVersion v2 = registryService.register(request("1.1.0"));
        registryService.promote(v1.getId());
        registryService.promote(v2.getId());

        ModelVersion restored = registryService.rollback("dixon-coles");

        assertThat(restored.getId()).isEqualTo(v1.getId());
        assertThat(registryService.getActive("dixon-coles").getId()).isEqualTo(v1.getId());
    }

    @Test
    @DisplayName("Promouvoir le canary le retire de la configuration A/B")
    void promotingCanaryClearsIt() {
        ModelVersion v1 = registryService.register(request("1.0.0"));
        ModelVersion v2 = registryService.register(request("1.1.0"));
        registryService.promote(v1.getId());
        registryService.configureCanary(20, v2.getId());

        registryService.promote(v2.getId());

        ABConfig config = registryService.getAbConfig();
        assertThat(config.hasCanary()).isFalse();
        assertThat(config.getCanaryPercentage()).isEqualTo(20);
    }

    @Test
    @DisplayName("Le canary doit exister, être inactif, et le pourcentage rester dans [0, 100]")
    void canaryConfigurationIsValidated() {
        ModelVersion v1 = registryService.register(request("1.0.0"));
        registryService.promote(v1.getId());

        assertThatThrownBy(() -> registryService.configureCanary(10, v1.getId())).isInstanceOf(InvalidSignalException.class);
        assertThatThrownBy(() -> registryService.configureCanary(101, null)).isInstanceOf(InvalidSignalException.class);
        assertThatThrownBy(() -> registryService.configureCanary(10, 999L)).isInstanceOf(ModelNotFoundException.class);
    }

    @Test
    @DisplayName("Versions servies : le canary du même modèle est inclus, celui d'un autre modèle est ignoré")
    void servedVersionsFollowCanaryRule() {
        ModelVersion v1 = registryService.register(request("1.0.0"));
        ModelVersion v2 = registryService.register(request("1.1.0"));
        RegisterModelRequest foreign = request("9.0.0");
        foreign.setModelName("poisson-alt");
        ModelVersion other = registryService.register(foreign);
        registryService.promote(v1.getId());

        registryService.configureCanary(20, v2.getId());
        assertThat(registryService.servedVersions("dixon-coles"))
                .extracting(ModelVersion::getId).containsExactly(v1.getId(), v2.getId());

        registryService.configureCanary(20, other.getId());
        assertThat(registryService.servedVersions("dixon-coles"))
                .extracting(ModelVersion::getId).containsExactly(v1.getId());
        assertThat(registryService.resolveCanary(registryService.getAbConfig(), v1)).isEmpty();
    }

    @Test
    @DisplayName("Modèle ou version inconnus : ModelNotFound")
    void unknownModelIsReported() {
        assertThatThrownBy(() -> registryService.getActive("inconnu")).isInstanceOf(ModelNotFoundException.class);
        assertThatThrownBy(() -> registryService.promote(12345L)).isInstanceOf(ModelNotFoundException.class);
        assertThatThrownBy(() -> registryService.rollback("inconnu")).isInstanceOf(ModelNotFoundException.class);
    }

    private static RegisterModelRequest request(String label) {
        RegisterModelRequest request = new RegisterModelRequest();
        request.setModelName("dixon-coles");
        request.setVersionLabel(label);
        request.setTrainedOn(LocalDate.of(2026, 3, 1));
        request.setAccuracy(0.52);
        return request;
    }
}
