package com.scenepilot.orchestrator.assets;

import com.scenepilot.orchestrator.error.StorageException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Opens the output an adapter pointed at. Supports http(s) URLs, file: URIs
 * and plain absolute paths.
 */
@Component
public class AssetSource {

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    public InputStream open(String outputRef) {
        try {
            if (outputRef.startsWith("http://") || outputRef.startsWith("https://")) {
                HttpRequest req = HttpRequest.newBuilder(URI.create(outputRef))
                        .timeout(Duration.ofMinutes(5))
                        .GET()
                        .build();
                HttpResponse<InputStream> resp = http.send(req, HttpResponse.BodyHandlers.ofInputStream());
                if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                    resp.body().close();
                    throw new StorageException("Download of " + outputRef + " failed: HTTP " + resp.statusCode());
                }
                return resp.body();
            }
            Path path = outputRef.startsWith("file:") ? Path.of(URI.create(outputRef)) : Path.of(outputRef);
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw new StorageException("Cannot read output " + outputRef, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while reading output " + outputRef, e);
        } catch (IllegalArgumentException e) {
            throw new StorageException("Unsupported output reference " + outputRef, e);
        }
    }
}
