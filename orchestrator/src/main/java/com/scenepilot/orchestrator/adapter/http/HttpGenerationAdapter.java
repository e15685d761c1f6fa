package com.scenepilot.orchestrator.adapter.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenepilot.orchestrator.adapter.*;
import com.scenepilot.orchestrator.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Adapter for providers that expose a plain asynchronous job API:
 * <pre>
 *   POST   {base}/jobs        → {"id": "..."}
 *   GET    {base}/jobs/{id}   → {"status": "running|succeeded|failed", "progress": 40,
 *                                "output_url": "...", "cost_credits": 1.5,
 *                                "error": "...", "retryable": true}
 *   DELETE {base}/jobs/{id}
 * </pre>
 *
 * Uses java.net.http.HttpClient so every header and status code is visible.
 * HTTP 429 is classified as rate-limited, 408/5xx and I/O errors as transient,
 * any other non-2xx as permanent.
 */
public class HttpGenerationAdapter implements GenerationAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpGenerationAdapter.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobAccepted(String id) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobStatus(
            String status,
            Integer progress,
            @JsonProperty("output_url")   String outputUrl,
            @JsonProperty("cost_credits") BigDecimal costCredits,
            String error,
            Boolean retryable
    ) {}

    private final TaskKind                     kind;
    private final ProviderProperties.Provider  config;
    private final ObjectMapper                 json;
    private final HttpClient                   http;

    public HttpGenerationAdapter(TaskKind kind, ProviderProperties.Provider config, ObjectMapper objectMapper) {
        this.kind   = kind;
        this.config = config;
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public TaskKind kind() {
        return kind;
    }

    @Override
    public Optional<TaskKind> prerequisite() {
        return Optional.ofNullable(config.prerequisite());
    }

    // ------------------------------------------------------------------
    // Contract
    // ------------------------------------------------------------------

    @Override
    public String submit(SceneContext ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("project_id", ctx.projectId().toString());
        body.put("scene_id",   ctx.sceneId().toString());
        body.put("task_id",    ctx.taskId().toString());
        body.put("kind",       kind.name().toLowerCase());
        body.put("position",   ctx.position());
        body.put("text",       ctx.sourceText());
        body.put("attempt",    ctx.attempt());
        if (ctx.prerequisiteRef() != null) {
            body.put("prerequisite_ref", ctx.prerequisiteRef());
        }

        HttpResponse<String> resp = send(request("/jobs")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build(), "submit");
        JobAccepted accepted = parse(resp.body(), JobAccepted.class, "submit");
        if (accepted.id() == null || accepted.id().isBlank()) {
            throw AdapterException.permanentFailure(kind + " provider accepted the job but returned no id");
        }
        log.info("{} provider accepted task {} as job {}", kind, ctx.taskId(), accepted.id());
        return accepted.id();
    }

    @Override
    public PollResult poll(String externalId) {
        HttpResponse<String> resp = send(request("/jobs/" + externalId).GET().build(), "poll " + externalId);
        JobStatus st = parse(resp.body(), JobStatus.class, "poll " + externalId);
        String status = st.status() == null ? "" : st.status().toLowerCase();
        return switch (status) {
            case "queued", "pending", "running", "processing" ->
                    PollResult.stillRunning(st.progress() == null ? 0 : st.progress());
            case "succeeded", "completed" -> {
                if (st.outputUrl() == null) {
                    yield PollResult.failedPermanent("Provider reported success without an output_url");
                }
                yield PollResult.succeeded(st.outputUrl(), st.costCredits());
            }
            case "failed", "error" -> Boolean.TRUE.equals(st.retryable())
                    ? PollResult.failedTransient(st.error())
                    : PollResult.failedPermanent(st.error());
            default -> PollResult.failedTransient("Unrecognised provider status '" + st.status() + "'");
        };
    }

    @Override
    public CancelResult cancel(String externalId) {
        try {
            HttpResponse<String> resp = http.send(request("/jobs/" + externalId).DELETE().build(),
                    HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
                return CancelResult.ACKNOWLEDGED;
            }
            log.warn("{} provider did not cancel job {}: HTTP {}", kind, externalId, resp.statusCode());
            return CancelResult.UNSUPPORTED;
        } catch (IOException e) {
            throw AdapterException.transientFailure("cancel " + externalId + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AdapterException.transientFailure("cancel " + externalId + " interrupted", e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static FailureClass classify(int httpStatus) {
        if (httpStatus == 429)                       return FailureClass.RATE_LIMITED;
        if (httpStatus == 408 || httpStatus >= 500)  return FailureClass.TRANSIENT;
        return FailureClass.PERMANENT;
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + path))
                .timeout(config.requestTimeout())
                .header("Accept", "application/json");
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            b.header("Authorization", "Bearer " + config.apiKey());
        }
        return b;
    }

    private HttpResponse<String> send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new AdapterException(classify(resp.statusCode()),
                        kind + " " + opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp;
        } catch (IOException e) {
            throw AdapterException.transientFailure(kind + " " + opName + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AdapterException.transientFailure(kind + " " + opName + " interrupted", e);
        }
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw AdapterException.transientFailure(
                    "Unparseable " + kind + " " + opName + " response: " + e.getOriginalMessage(), e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw AdapterException.permanentFailure("JSON serialization failed: " + e.getOriginalMessage());
        }
    }
}
