package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.model.CalibrationEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface CalibrationEventRepository extends JpaRepository<CalibrationEvent, Long> {

    boolean existsByFixtureIdAndModelVersionId(Long fixtureId, Long modelVersionId);

    // Intervalle semi-ouvert [from, to[
    @Query("SELECT e FROM CalibrationEvent e WHERE e.modelVersionId = :versionId " +
            "AND e.createdAt >= :from AND e.createdAt < :to ORDER BY e.createdAt ASC")
    List<CalibrationEvent> findInWindow(@Param("versionId") Long versionId,
                                        @Param("from") Instant from,
                                        @Param("to") Instant to);
}
