package com.scenepilot.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request body for POST /projects.
 *
 * Either {@code script} (split into scenes on blank lines) or an explicit
 * {@code scenes} list; the list wins when both are given.
 */
public record CreateProjectRequest(@NotBlank String name, String script, List<String> scenes) {}
