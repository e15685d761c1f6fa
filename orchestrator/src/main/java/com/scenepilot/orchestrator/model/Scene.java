package com.scenepilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One scene of a project's script.
 *
 * The position is fixed at ingestion and defines ordering inside the project.
 * Asset references are filled in progressively as tasks succeed; they can be
 * replaced by a newer asset but never cleared.
 *
 * DB table: scenes
 */
@Entity
@Table(name = "scenes",
       uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "position"}))
public class Scene {

    @Id
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    // 1-based, unique within the project.
    @Column(nullable = false, updatable = false)
    private int position;

    @Column(name = "source_text", nullable = false, columnDefinition = "TEXT")
    private String sourceText;

    // Paths relative to the storage root, e.g. projects/{id}/scene-1/images/image-1a2b.png
    @Column(name = "image_ref")
    private String imageRef;

    @Column(name = "audio_ref")
    private String audioRef;

    @Column(name = "video_ref")
    private String videoRef;

    // Comma-separated TaskKind names advanced past via forceAdvance.
    @Column(name = "degraded_kinds", nullable = false)
    private String degradedKinds = "";

    @Column(name = "folder_path", nullable = false)
    private String folderPath;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Version
    private Long version;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Scene() {}   // required by JPA

    public Scene(UUID projectId, int position, String sourceText, String folderPath) {
        if (position < 1) {
            throw new IllegalArgumentException("Scene position must be >= 1, got " + position);
        }
        this.id         = UUID.randomUUID();
        this.projectId  = projectId;
        this.position   = position;
        this.sourceText = sourceText;
        this.folderPath = folderPath;
    }

    // ------------------------------------------------------------------
    // Assets
    // ------------------------------------------------------------------

    public String assetRef(TaskKind kind) {
        return switch (kind) {
            case IMAGE -> imageRef;
            case VOICE -> audioRef;
            case VIDEO -> videoRef;
        };
    }

    public boolean hasAsset(TaskKind kind) {
        return assetRef(kind) != null;
    }

    /** Record (or replace) the asset of a kind. A reference can never be cleared. */
    public void attachAsset(TaskKind kind, String ref) {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("Asset reference for " + kind + " must not be blank");
        }
        switch (kind) {
            case IMAGE -> this.imageRef = ref;
            case VOICE -> this.audioRef = ref;
            case VIDEO -> this.videoRef = ref;
        }
        this.updatedAt = Instant.now();
    }

    public Set<TaskKind> getDegradedKinds() {
        if (degradedKinds.isBlank()) return EnumSet.noneOf(TaskKind.class);
        return Arrays.stream(degradedKinds.split(","))
                .map(TaskKind::valueOf)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(TaskKind.class)));
    }

    public boolean isDegraded(TaskKind kind) {
        return getDegradedKinds().contains(kind);
    }

    public void markDegraded(TaskKind kind) {
        Set<TaskKind> kinds = getDegradedKinds();
        kinds.add(kind);
        writeDegraded(kinds);
    }

    /** Drop degraded flags for stages that are about to be re-run. Assets stay. */
    public void clearDegraded(Collection<TaskKind> kinds) {
        Set<TaskKind> current = getDegradedKinds();
        current.removeAll(kinds);
        writeDegraded(current);
    }

    private void writeDegraded(Set<TaskKind> kinds) {
        this.degradedKinds = kinds.stream().map(Enum::name).collect(Collectors.joining(","));
        this.updatedAt = Instant.now();
    }

    /** Detached copy used by the in-memory store. */
    public Scene copy() {
        Scene s = new Scene();
        s.id            = id;
        s.projectId     = projectId;
        s.position      = position;
        s.sourceText    = sourceText;
        s.imageRef      = imageRef;
        s.audioRef      = audioRef;
        s.videoRef      = videoRef;
        s.degradedKinds = degradedKinds;
        s.folderPath    = folderPath;
        s.createdAt     = createdAt;
        s.updatedAt     = updatedAt;
        s.version       = version;
        return s;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID    getId()         { return id; }
    public UUID    getProjectId()  { return projectId; }
    public int     getPosition()   { return position; }
    public String  getSourceText() { return sourceText; }
    public String  getFolderPath() { return folderPath; }
    public Instant getCreatedAt()  { return createdAt; }
    public Instant getUpdatedAt()  { return updatedAt; }
    public Long    getVersion()    { return version; }

    public void setVersion(Long version) { this.version = version; }
}
