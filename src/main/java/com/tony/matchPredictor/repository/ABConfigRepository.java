package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.model.ABConfig;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ABConfigRepository extends JpaRepository<ABConfig, Long> {
}
