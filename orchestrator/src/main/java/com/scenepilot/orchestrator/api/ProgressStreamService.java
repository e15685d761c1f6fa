package com.scenepilot.orchestrator.api;

import com.scenepilot.orchestrator.events.ProgressEvent;
import com.scenepilot.orchestrator.events.ProgressEventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link ProgressEventBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * Each emitter subscribes to one project or task topic and forwards events as
 * named SSE frames. Nothing is replayed: a client that reconnects reads the
 * current state over REST and then follows the stream. Heartbeat comments
 * every 30 seconds keep idle connections open through proxies.
 */
@Service
public class ProgressStreamService {

    private static final Logger log = LoggerFactory.getLogger(ProgressStreamService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final ProgressEventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ProgressStreamService(ProgressEventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    ProgressStreamService(ProgressEventBus eventBus, long timeoutMs) {
        this.eventBus  = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // The emitter's completion/error callbacks unsubscribe it.
                log.debug("Heartbeat to topic {} failed: {}", registration.topic, e.getMessage());
            }
        }
    }

    /**
     * Open a stream for a project or task id.
     */
    public SseEmitter createEmitter(UUID topic) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        ProgressEventBus.Subscription subscription = eventBus.subscribe(topic, event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(topic, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> cleanup(registration));

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for topic {}: {}", topic, e.getMessage());
        }
        log.info("SSE stream opened for {} (timeout={}ms)", topic, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, ProgressEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("projectId", event.projectId());
        if (event.taskId() != null) {
            data.put("taskId", event.taskId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            emitter.send(SseEmitter.event().name(event.type().wireName()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping {} event for project {}: {}", event.type(), event.projectId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("SSE stream closed for {}", registration.topic);
    }

    private record EmitterRegistration(UUID topic, SseEmitter emitter, ProgressEventBus.Subscription subscription) {}
}
