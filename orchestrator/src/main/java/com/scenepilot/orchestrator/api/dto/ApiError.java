package com.scenepilot.orchestrator.api.dto;

/** Error body: {@code code} is the stable error name, {@code message} is for humans. */
public record ApiError(String code, String message) {}
