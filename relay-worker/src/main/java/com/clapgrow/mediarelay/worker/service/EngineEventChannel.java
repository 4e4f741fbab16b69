package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.model.EngineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Ordered queue of engine lifecycle events with a single consumer thread.
 * 
 * Events are handled strictly in arrival order, one at a time. A handler
 * failure is logged and the consumer moves on to the next event.
 */
@Component
@Slf4j
public class EngineEventChannel {
    
    private final BlockingQueue<EngineEvent> queue = new LinkedBlockingQueue<>();
    private Thread consumer;
    
    public void publish(EngineEvent event) {
        queue.offer(event);
        log.debug("Queued engine event {}", event.type());
    }
    
    /**
     * Start delivering events to the handler. No-op if already started.
     */
    public synchronized void start(Consumer<EngineEvent> handler) {
        if (consumer != null) {
            return;
        }
        consumer = new Thread(() -> consume(handler), "engine-events");
        consumer.setDaemon(true);
        consumer.start();
        log.info("Engine event consumer started");
    }
    
    public synchronized void stop() {
        if (consumer != null) {
            consumer.interrupt();
            consumer = null;
            log.info("Engine event consumer stopped");
        }
    }
    
    public int pendingEvents() {
        return queue.size();
    }
    
    private void consume(Consumer<EngineEvent> handler) {
        while (!Thread.currentThread().isInterrupted()) {
            EngineEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                handler.accept(event);
            } catch (Exception e) {
                log.error("Failed to handle engine event {}", event.type(), e);
            }
        }
    }
}
