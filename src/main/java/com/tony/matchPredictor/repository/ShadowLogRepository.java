package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.model.ShadowLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ShadowLogRepository extends JpaRepository<ShadowLogEntry, Long> {

    List<ShadowLogEntry> findByFixtureIdOrderByCreatedAtDesc(Long fixtureId);
}
