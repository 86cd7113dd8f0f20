package com.tony.matchPredictor.repository;

import com.tony.matchPredictor.model.ABAssignment;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ABAssignmentRepository extends JpaRepository<ABAssignment, String> {
}
