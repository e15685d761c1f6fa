package com.scenepilot.orchestrator.repository;

import com.scenepilot.orchestrator.model.Project;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * CRUD operations for the projects table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface ProjectRepository extends JpaRepository<Project, UUID> {
}
