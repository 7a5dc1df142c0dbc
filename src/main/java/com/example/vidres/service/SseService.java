package com.example.vidres.service;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Interface for managing Server-Sent Event emitters and sending events to subscribers.
 */
public interface SseService {

    /**
     * Adds a new SseEmitter for a subscriber.
     *
     * @param subscriber The subscriber key, e.g. {@code user:42}.
     * @param emitter    The SseEmitter instance.
     */
    void addEmitter(String subscriber, SseEmitter emitter);

    void removeEmitter(String subscriber, SseEmitter emitter);

    /**
     * Sends an event to all active SseEmitters of a subscriber.
     *
     * @param subscriber The target subscriber key.
     * @param eventData  The data object to send (will be serialized).
     * @param eventName  The name of the SSE event.
     */
    void sendEventToSubscriber(String subscriber, Object eventData, String eventName);
}
