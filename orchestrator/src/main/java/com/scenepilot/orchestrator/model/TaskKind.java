package com.scenepilot.orchestrator.model;

/**
 * The three generation kinds a scene passes through.
 *
 * Each kind maps to one external adapter, one concurrency pool and one
 * asset folder inside the scene directory.
 */
public enum TaskKind {
    IMAGE("images", "image"),   // storyboard frame
    VOICE("audio",  "audio"),   // narration track
    VIDEO("videos", "video");   // motion clip

    private final String folder;
    private final String manifestKey;

    TaskKind(String folder, String manifestKey) {
        this.folder      = folder;
        this.manifestKey = manifestKey;
    }

    /** Sub-directory of the scene folder that holds assets of this kind. */
    public String folder()      { return folder; }

    /** Field name under {@code assets} in metadata/scene.json. */
    public String manifestKey() { return manifestKey; }
}
