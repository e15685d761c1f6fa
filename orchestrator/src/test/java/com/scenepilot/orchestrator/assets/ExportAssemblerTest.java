package com.scenepilot.orchestrator.assets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenepilot.orchestrator.error.StorageException;
import com.scenepilot.orchestrator.model.Project;
import com.scenepilot.orchestrator.model.Scene;
import com.scenepilot.orchestrator.model.TaskKind;
import com.scenepilot.orchestrator.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportAssemblerTest {

    @TempDir Path tmp;

    MutableClock    clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    ObjectMapper    mapper = new ObjectMapper();
    AssetOrganizer  organizer;
    ExportAssembler assembler;
    Project         project;

    @BeforeEach
    void setUp() {
        organizer = new AssetOrganizer(tmp.toString(), new AssetSource(), mapper, clock);
        assembler = new ExportAssembler(organizer, mapper, clock);
        project = new Project("demo");
        project.addCost(new BigDecimal("7.5"));
    }

    private Scene scene(int position, TaskKind... withAssets) {
        Scene scene = new Scene(project.getId(), position, "text " + position,
                AssetOrganizer.sceneFolder(project.getId(), position));
        for (TaskKind kind : withAssets) {
            scene.attachAsset(kind, scene.getFolderPath() + "/" + kind.folder() + "/" + kind.manifestKey() + ".bin");
        }
        return scene;
    }

    @Test
    void assemble_writesProjectExportAndPerSceneManifests() throws Exception {
        Scene first = scene(1, TaskKind.values());
        Scene second = scene(2, TaskKind.IMAGE, TaskKind.VIDEO);
        second.markDegraded(TaskKind.VOICE);

        String path = assembler.assemble(project, List.of(first, second));

        assertThat(path).isEqualTo("projects/" + project.getId() + "/export.json");
        JsonNode export = mapper.readTree(Files.readString(tmp.resolve(path)));
        assertThat(export.path("name").asText()).isEqualTo("demo");
        assertThat(export.path("exportedAt").asText()).isEqualTo("2026-03-01T12:00:00Z");
        assertThat(export.path("totalCostCredits").decimalValue()).isEqualByComparingTo("7.5");
        assertThat(export.path("scenes")).hasSize(2);
        JsonNode degraded = export.path("scenes").get(1);
        assertThat(degraded.path("assets").path("audio").isNull()).isTrue();
        assertThat(degraded.path("degraded").get(0).asText()).isEqualTo("audio");

        JsonNode sceneManifest = mapper.readTree(
                Files.readString(tmp.resolve(first.getFolderPath()).resolve("exports/manifest.json")));
        assertThat(sceneManifest.path("index").asInt()).isEqualTo(1);
        assertThat(sceneManifest.path("projectId").asText()).isEqualTo(project.getId().toString());
        assertThat(sceneManifest.path("assets").path("video").asText()).endsWith("video.bin");
    }

    @Test
    void assemble_missingAssetNotDegraded_fails() {
        Scene incomplete = scene(1, TaskKind.IMAGE);

        assertThatThrownBy(() -> assembler.assemble(project, List.of(incomplete)))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("audio");
        assertThat(tmp.resolve("projects/" + project.getId() + "/export.json")).doesNotExist();
    }

    @Test
    void assemble_noScenes_fails() {
        assertThatThrownBy(() -> assembler.assemble(project, List.of()))
                .isInstanceOf(StorageException.class);
    }
}
