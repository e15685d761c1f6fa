package com.scenepilot.orchestrator.repository;

import com.scenepilot.orchestrator.model.Scene;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SceneRepository extends JpaRepository<Scene, UUID> {

    /** Scenes of a project in script order. */
    List<Scene> findByProjectIdOrderByPositionAsc(UUID projectId);
}
