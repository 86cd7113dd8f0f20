package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.model.ModelVersion;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ModelVersionRepository extends JpaRepository<ModelVersion, Long> {

    Optional<ModelVersion> findByModelNameAndActiveTrue(String modelName);

    List<ModelVersion> findByModelNameOrderByIdAsc(String modelName);

    boolean existsByModelNameAndVersionLabel(String modelName, String versionLabel);

    // Verrouille toutes les versions d'un modèle (ordre des ids = pas d'interblocage entre promotions)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM ModelVersion m WHERE m.modelName = :modelName ORDER BY m.id ASC")
    List<ModelVersion> lockAllByModelName(@Param("modelName") String modelName);
}
