package com.scenepilot.orchestrator.assets;

/** An asset written into a scene folder. {@code path} is relative to the storage root. */
public record StoredAsset(String path, long bytes) {}
