package com.example.vidres.service.impl;

import com.example.vidres.service.SseService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Service
public class SseServiceImpl implements SseService {

    private static final Logger log = LoggerFactory.getLogger(SseServiceImpl.class);
    private final Map<String, CopyOnWriteArrayList<SseEmitter>> subscriberEmitters = new ConcurrentHashMap<>();

    @Override
    public void addEmitter(String subscriber, SseEmitter emitter) {
        CopyOnWriteArrayList<SseEmitter> emitters =
                this.subscriberEmitters.computeIfAbsent(subscriber, k -> new CopyOnWriteArrayList<>());
        emitters.add(emitter);
        log.info("Added SSE emitter for {}. Total emitters: {}", subscriber, emitters.size());

        Runnable cleanup = () -> {
            log.debug("SSE emitter cleanup triggered for {}", subscriber);
            removeEmitter(subscriber, emitter);
        };

        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(e -> {
            log.warn("SSE emitter error for {}. Removing emitter: {}", subscriber, e.getMessage());
            cleanup.run();
        });
    }

    @Override
    public void removeEmitter(String subscriber, SseEmitter emitter) {
        if (subscriber == null || emitter == null) {
            log.warn("Attempted to remove null subscriber or emitter.");
            return;
        }
        // drops the subscriber once its last emitter is gone
        subscriberEmitters.computeIfPresent(subscriber, (key, emitters) -> {
            if (emitters.remove(emitter)) {
                log.info("Removed SSE emitter for {}. Remaining emitters: {}", key, emitters.size());
            }
            return emitters.isEmpty() ? null : emitters;
        });
    }

    @Override
    public void sendEventToSubscriber(String subscriber, Object eventData, String eventName) {
        List<SseEmitter> emitters = this.subscriberEmitters.get(subscriber);
        if (emitters == null || emitters.isEmpty()) {
            log.debug("No active SSE emitters for {} when trying to send event: {}", subscriber, eventName);
            return;
        }

        log.info("Sending SSE event '{}' to {}", eventName, subscriber);
        for (SseEmitter emitter : List.copyOf(emitters)) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(eventData));
            } catch (IOException e) {
                log.warn("Failed to send SSE event '{}' to {}. Removing emitter. Error: {}",
                        eventName, subscriber, e.getMessage());
                removeEmitter(subscriber, emitter);
            } catch (Exception e) {
                log.error("Unexpected error sending SSE event '{}' to {}. Removing emitter.", eventName, subscriber, e);
                removeEmitter(subscriber, emitter);
            }
        }
    }

    @Scheduled(fixedRate = 20000)
    public void sendHeartbeat() {
        if (subscriberEmitters.isEmpty()) {
            return;
        }
        log.trace("Sending SSE heartbeats to {} subscribers.", subscriberEmitters.size());
        for (Map.Entry<String, CopyOnWriteArrayList<SseEmitter>> entry : subscriberEmitters.entrySet()) {
            String subscriber = entry.getKey();
            for (SseEmitter emitter : List.copyOf(entry.getValue())) {
                try {
                    emitter.send(SseEmitter.event().comment("keep-alive"));
                } catch (IOException e) {
                    log.warn("Failed to send heartbeat to {}. Removing emitter. Error: {}", subscriber, e.getMessage());
                    removeEmitter(subscriber, emitter);
                } catch (Exception e) {
                    log.error("Unexpected error sending heartbeat to {}. Removing emitter.", subscriber, e);
                    removeEmitter(subscriber, emitter);
                }
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down SseService. Completing all active emitters...");
        int completedCount = 0;
        for (Map.Entry<String, CopyOnWriteArrayList<SseEmitter>> entry : Map.copyOf(subscriberEmitters).entrySet()) {
            for (SseEmitter emitter : List.copyOf(entry.getValue())) {
                try {
                    emitter.complete();
                    completedCount++;
                } catch (Exception e) {
                    log.warn("Error completing emitter for {} during shutdown: {}", entry.getKey(), e.getMessage());
                }
            }
        }
        subscriberEmitters.clear();
        log.info("SseService shutdown complete. Completed {} emitters.", completedCount);
    }
}
