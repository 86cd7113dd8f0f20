package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.model.FixtureSignals;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FixtureSignalsRepository extends JpaRepository<FixtureSignals, Long> {
}
