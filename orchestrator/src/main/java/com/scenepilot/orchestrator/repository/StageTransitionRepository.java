package com.scenepilot.orchestrator.repository;

import com.scenepilot.orchestrator.model.StageTransitionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Append-only audit trail. Only insert and read are used.
 */
public interface StageTransitionRepository extends JpaRepository<StageTransitionRecord, UUID> {

    List<StageTransitionRecord> findByProjectIdOrderByCreatedAtAsc(UUID projectId);
}
