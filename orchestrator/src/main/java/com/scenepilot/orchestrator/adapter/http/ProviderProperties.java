package com.scenepilot.orchestrator.adapter.http;

import com.scenepilot.orchestrator.model.TaskKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Connection settings for the HTTP generation providers.
 *
 * <pre>
 * scenepilot:
 *   adapters:
 *     providers:
 *       video:
 *         base-url: https://video.example.com/v1
 *         api-key: ${VIDEO_API_KEY}
 *         prerequisite: image
 * </pre>
 *
 * A kind without an entry has no adapter.
 */
@ConfigurationProperties(prefix = "scenepilot.adapters")
public record ProviderProperties(Map<TaskKind, Provider> providers) {

    public ProviderProperties {
        providers = providers == null ? Map.of() : Map.copyOf(providers);
    }

    public record Provider(String baseUrl, String apiKey, TaskKind prerequisite, Duration requestTimeout) {

        public Provider {
            if (requestTimeout == null) requestTimeout = Duration.ofSeconds(30);
        }
    }
}
