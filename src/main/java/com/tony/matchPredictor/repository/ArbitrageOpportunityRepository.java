package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.model.ArbitrageOpportunity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface ArbitrageOpportunityRepository extends JpaRepository<ArbitrageOpportunity, Long> {

    List<ArbitrageOpportunity> findByDetectedAtAfterOrderByDetectedAtDesc(Instant since);
}
