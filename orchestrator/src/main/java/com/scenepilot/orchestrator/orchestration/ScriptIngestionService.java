package com.scenepilot.orchestrator.orchestration;

import com.scenepilot.orchestrator.assets.AssetOrganizer;
import com.scenepilot.orchestrator.error.ValidationException;
import com.scenepilot.orchestrator.model.Project;
import com.scenepilot.orchestrator.model.Scene;
import com.scenepilot.orchestrator.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a script into a Draft project with one scene per paragraph.
 */
@Service
public class ScriptIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ScriptIngestionService.class);

    // One or more blank lines separate scenes.
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\R[ \\t]*\\R\\s*");

    private final StateStore     store;
    private final AssetOrganizer assets;

    public ScriptIngestionService(StateStore store, AssetOrganizer assets) {
        this.store  = store;
        this.assets = assets;
    }

    /**
     * Create a project.
     *
     * @param script free text split into scenes on blank lines; ignored when
     *               {@code scenes} is non-empty
     * @param scenes explicit scene texts, taken in order
     * @throws ValidationException if the name is blank or no scene text remains
     */
    public Project ingest(String name, String script, List<String> scenes) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Project name must not be blank");
        }
        List<String> texts = scenes != null && !scenes.isEmpty() ? explicit(scenes) : split(script);
        if (texts.isEmpty()) {
            throw new ValidationException("Script contains no scenes");
        }

        Project project = new Project(name.trim());
        List<Scene> sceneList = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            int position = i + 1;
            Scene scene = new Scene(project.getId(), position, texts.get(i),
                    AssetOrganizer.sceneFolder(project.getId(), position));
            assets.prepareSceneFolder(scene);
            sceneList.add(scene);
        }
        Project created = store.createProject(project, sceneList);
        log.info("Project {} '{}' created with {} scene(s)", created.getId(), created.getName(), sceneList.size());
        return created;
    }

    static List<String> split(String script) {
        if (script == null) return List.of();
        return Arrays.stream(PARAGRAPH_BREAK.split(script.strip()))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static List<String> explicit(List<String> scenes) {
        List<String> out = new ArrayList<>(scenes.size());
        for (int i = 0; i < scenes.size(); i++) {
            String text = scenes.get(i);
            if (text == null || text.isBlank()) {
                throw new ValidationException("Scene " + (i + 1) + " is blank");
            }
            out.add(text.strip());
        }
        return out;
    }
}
