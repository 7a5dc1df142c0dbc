package com.example.vidres.web.controller;

import com.example.vidres.domain.OwnerKey;
import com.example.vidres.service.SseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

@RestController
@RequestMapping("/api/users")
public class SseController {

    private static final Logger log = LoggerFactory.getLogger(SseController.class);

    private final SseService sseService;
    private final long sseEmitterTimeout;

    public SseController(SseService sseService, @Value("${sse.emitter.timeout.ms}") long sseEmitterTimeout) {
        this.sseService = sseService;
        this.sseEmitterTimeout = sseEmitterTimeout;
    }

    @GetMapping(path = "/{userId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> subscribe(@PathVariable long userId) {
        String subscriber = OwnerKey.user(userId).toString();
        log.info("SSE subscription request received for {}", subscriber);

        SseEmitter emitter = new SseEmitter(sseEmitterTimeout);
        try {
            emitter.send(SseEmitter.event().comment("SSE connection established"));
        } catch (IOException e) {
            log.error("Failed to send initial SSE comment to {}: {}", subscriber, e.getMessage(), e);
            emitter.completeWithError(e);
            return ResponseEntity.internalServerError().build();
        }

        sseService.addEmitter(subscriber, emitter);
        return ResponseEntity.ok(emitter);
    }
}
