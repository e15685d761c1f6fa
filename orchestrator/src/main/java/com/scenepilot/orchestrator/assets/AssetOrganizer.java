package com.scenepilot.orchestrator.assets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scenepilot.orchestrator.error.StorageException;
import com.scenepilot.orchestrator.model.Scene;
import com.scenepilot.orchestrator.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Owns the on-disk asset tree:
 *
 * <pre>
 * projects/{projectId}/scene-{position}/
 *     images/ audio/ videos/ metadata/ exports/
 *     metadata/scene.json
 * </pre>
 *
 * Assets and manifests are written to a temporary sibling and renamed into
 * place. Manifest updates read the current document, change only the fields
 * they own and write it back under a per-scene lock, so an image and a voice
 * result landing at the same time never lose each other's entry.
 */
@Component
public class AssetOrganizer {

    private static final Logger log = LoggerFactory.getLogger(AssetOrganizer.class);

    static final String MANIFEST = "metadata/scene.json";
    static final String[] SUBFOLDERS = {"images", "audio", "videos", "metadata", "exports"};

    private static final Pattern EXTENSION = Pattern.compile("\\.([A-Za-z0-9]{1,5})$");

    private final Path          root;
    private final AssetSource   source;
    private final ObjectMapper  mapper;
    private final Clock         clock;

    private final ConcurrentHashMap<String, Object> sceneLocks = new ConcurrentHashMap<>();

    public AssetOrganizer(@Value("${scenepilot.storage.root:./data}") String root,
                          AssetSource source,
                          ObjectMapper mapper,
                          Clock clock) {
        this.root   = Path.of(root).toAbsolutePath().normalize();
        this.source = source;
        this.mapper = mapper;
        this.clock  = clock;
    }

    public static String sceneFolder(UUID projectId, int position) {
        return "projects/" + projectId + "/scene-" + position;
    }

    public static String projectFolder(UUID projectId) {
        return "projects/" + projectId;
    }

    public Path resolve(String relative) {
        Path p = root.resolve(relative).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Path escapes storage root: " + relative);
        }
        return p;
    }

    // ------------------------------------------------------------------
    // Scene folders
    // ------------------------------------------------------------------

    /** Create the folder tree and a seed manifest. Existing manifests are left alone. */
    public void prepareSceneFolder(Scene scene) {
        Path dir = resolve(scene.getFolderPath());
        try {
            for (String sub : SUBFOLDERS) {
                Files.createDirectories(dir.resolve(sub));
            }
        } catch (IOException e) {
            throw new StorageException("Cannot create scene folder " + dir, e);
        }
        synchronized (lockFor(scene)) {
            Path manifest = dir.resolve(MANIFEST);
            if (Files.exists(manifest)) {
                return;
            }
            ObjectNode seed = mapper.createObjectNode();
            seed.put("sceneId", scene.getId().toString());
            seed.put("projectId", scene.getProjectId().toString());
            seed.put("index", scene.getPosition());
            String now = clock.instant().toString();
            seed.put("createdAt", now);
            seed.put("updatedAt", now);
            seed.putObject("assets");
            seed.putArray("degraded");
            writeJson(manifest, seed);
        }
    }

    // ------------------------------------------------------------------
    // Assets
    // ------------------------------------------------------------------

    /**
     * Copy a task output into the scene's folder for its kind and point the
     * manifest entry for that kind at it.
     */
    public StoredAsset store(Scene scene, TaskKind kind, String outputRef, UUID taskId) {
        String fileName = kind.manifestKey() + "-" + taskId + extensionOf(outputRef);
        String relative = scene.getFolderPath() + "/" + kind.folder() + "/" + fileName;
        Path target = resolve(relative);

        long bytes;
        try (InputStream in = source.open(outputRef)) {
            bytes = AtomicFiles.write(target, in);
        } catch (IOException e) {
            throw new StorageException("Cannot write " + kind + " asset for scene " + scene.getId(), e);
        }

        updateManifest(scene, doc -> {
            JsonNode existing = doc.get("assets");
            ObjectNode assets = existing instanceof ObjectNode ? (ObjectNode) existing : doc.putObject("assets");
            ObjectNode entry = assets.putObject(kind.manifestKey());
            entry.put("path", relative);
            entry.put("taskId", taskId.toString());
            entry.put("source", outputRef);
            entry.put("bytes", bytes);
            entry.put("storedAt", clock.instant().toString());
        });
        log.info("Stored {} asset for scene {} at {} ({} bytes)", kind, scene.getId(), relative, bytes);
        return new StoredAsset(relative, bytes);
    }

    /** Mirror the scene's degraded kinds into its manifest. */
    public void recordDegraded(Scene scene) {
        updateManifest(scene, doc -> {
            ArrayNode degraded = doc.putArray("degraded");
            scene.getDegradedKinds().forEach(k -> degraded.add(k.manifestKey()));
        });
    }

    public JsonNode readManifest(Scene scene) {
        Path manifest = resolve(scene.getFolderPath()).resolve(MANIFEST);
        try {
            return mapper.readTree(manifest.toFile());
        } catch (IOException e) {
            throw new StorageException("Cannot read manifest " + manifest, e);
        }
    }

    void writeJson(Path target, JsonNode doc) {
        try {
            AtomicFiles.write(target, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(doc));
        } catch (IOException e) {
            throw new StorageException("Cannot write " + target, e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private interface ManifestEdit {
        void apply(ObjectNode doc);
    }

    private void updateManifest(Scene scene, ManifestEdit edit) {
        Path manifest = resolve(scene.getFolderPath()).resolve(MANIFEST);
        synchronized (lockFor(scene)) {
            ObjectNode doc;
            try {
                doc = Files.exists(manifest)
                        ? (ObjectNode) mapper.readTree(manifest.toFile())
                        : mapper.createObjectNode();
            } catch (IOException | ClassCastException e) {
                throw new StorageException("Corrupt manifest " + manifest, e);
            }
            edit.apply(doc);
            doc.put("updatedAt", clock.instant().toString());
            writeJson(manifest, doc);
        }
    }

    private Object lockFor(Scene scene) {
        return sceneLocks.computeIfAbsent(scene.getFolderPath(), k -> new Object());
    }

    static String extensionOf(String outputRef) {
        String path = outputRef;
        int q = path.indexOf('?');
        if (q >= 0) path = path.substring(0, q);
        int slash = path.lastIndexOf('/');
        if (slash >= 0) path = path.substring(slash + 1);
        var m = EXTENSION.matcher(path);
        return m.find() ? "." + m.group(1).toLowerCase(Locale.ROOT) : ".bin";
    }
}
