package com.clapgrow.mediarelay.worker.controller;

import com.clapgrow.mediarelay.worker.service.SseEventSink;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Events", description = "Live status, QR codes, groups and progress log")
public class EventStreamController {

    private final SseEventSink eventSink;

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Subscribe to relay events",
               description = "Sends the current snapshot first, then status, qr, ready, reset, log and groups events as they happen")
    public SseEmitter subscribe() {
        return eventSink.subscribe();
    }
}
