package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.model.ModelMetricsDaily;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ModelMetricsDailyRepository extends JpaRepository<ModelMetricsDaily, Long> {

    Optional<ModelMetricsDaily> findByModelVersionIdAndDay(Long modelVersionId, LocalDate day);

    List<ModelMetricsDaily> findByModelVersionIdAndDayBetweenOrderByDayAsc(Long modelVersionId, LocalDate from, LocalDate to);

    Optional<ModelMetricsDaily> findFirstByModelVersionIdAndEceIsNotNullOrderByDayDesc(Long modelVersionId);
}
