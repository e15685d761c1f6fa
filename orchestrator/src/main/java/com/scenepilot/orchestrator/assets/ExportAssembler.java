package com.scenepilot.orchestrator.assets;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scenepilot.orchestrator.error.StorageException;
import com.scenepilot.orchestrator.model.Project;
import com.scenepilot.orchestrator.model.Scene;
import com.scenepilot.orchestrator.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Builds the export: one {@code exports/manifest.json} per scene and a
 * project-level {@code export.json} that lists the scenes in order.
 *
 * A scene must either hold an asset of every kind or be marked degraded for
 * the kinds it lacks; anything else means the asset tree is inconsistent and
 * the export fails.
 */
@Component
public class ExportAssembler {

    private static final Logger log = LoggerFactory.getLogger(ExportAssembler.class);

    private final AssetOrganizer organizer;
    private final ObjectMapper   mapper;
    private final Clock          clock;

    public ExportAssembler(AssetOrganizer organizer, ObjectMapper mapper, Clock clock) {
        this.organizer = organizer;
        this.mapper    = mapper;
        this.clock     = clock;
    }

    /** @return storage-relative path of the project export file */
    public String assemble(Project project, List<Scene> scenes) {
        if (scenes.isEmpty()) {
            throw new StorageException("Project " + project.getId() + " has no scenes to export");
        }
        String exportedAt = clock.instant().toString();

        ObjectNode export = mapper.createObjectNode();
        export.put("projectId", project.getId().toString());
        export.put("name", project.getName());
        export.put("exportedAt", exportedAt);
        export.put("totalCostCredits", project.getCostCredits());
        ArrayNode list = export.putArray("scenes");

        for (Scene scene : scenes) {
            ObjectNode entry = sceneEntry(scene);
            ObjectNode sceneManifest = entry.deepCopy();
            sceneManifest.put("projectId", project.getId().toString());
            sceneManifest.put("exportedAt", exportedAt);
            Path target = organizer.resolve(scene.getFolderPath()).resolve("exports/manifest.json");
            organizer.writeJson(target, sceneManifest);
            list.add(entry);
        }

        String relative = AssetOrganizer.projectFolder(project.getId()) + "/export.json";
        organizer.writeJson(organizer.resolve(relative), export);
        log.info("Export for project {} written to {} ({} scenes)", project.getId(), relative, scenes.size());
        return relative;
    }

    private ObjectNode sceneEntry(Scene scene) {
        ObjectNode entry = mapper.createObjectNode();
        entry.put("sceneId", scene.getId().toString());
        entry.put("index", scene.getPosition());
        ObjectNode assets = entry.putObject("assets");
        ArrayNode degraded = entry.putArray("degraded");
        for (TaskKind kind : TaskKind.values()) {
            if (scene.hasAsset(kind)) {
                assets.put(kind.manifestKey(), scene.assetRef(kind));
            } else if (scene.isDegraded(kind)) {
                assets.putNull(kind.manifestKey());
            } else {
                throw new StorageException("Scene " + scene.getPosition()
                        + " has no " + kind.manifestKey() + " asset and is not marked degraded");
            }
            if (scene.isDegraded(kind)) {
                degraded.add(kind.manifestKey());
            }
        }
        return entry;
    }
}
