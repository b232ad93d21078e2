package com.powerlevel.tracker.controller;

import com.powerlevel.tracker.exception.CacheWriteException;
import com.powerlevel.tracker.exception.InvalidTrackerConfigException;
import com.powerlevel.tracker.exception.RemoteClientException;
import com.powerlevel.tracker.exception.SessionNotStartedException;
import com.powerlevel.tracker.model.DetectedEvent;
import com.powerlevel.tracker.model.EpicStatus;
import com.powerlevel.tracker.service.TrackerSessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/tracker")
public class TrackerController {

    @Autowired
    private TrackerSessionService sessionService;

    @PostMapping("/session/start")
    public ResponseEntity<?> startSession(@RequestBody Map<String, String> payload) {
        String repoPath = payload.get("repo_path");
        if (repoPath == null || repoPath.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "repo_path is required"));
        }
        return ResponseEntity.ok(sessionService.startSession(Path.of(repoPath)));
    }

    @PostMapping("/session/idle")
    public ResponseEntity<?> idle() {
        return ResponseEntity.ok(sessionService.idle());
    }

    @PostMapping("/sync")
    public ResponseEntity<?> sync() {
        return ResponseEntity.ok(sessionService.sync());
    }

    @PostMapping("/events")
    public ResponseEntity<?> handleEvent(@RequestBody DetectedEvent event) {
        if (event.getKind() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "kind is required"));
        }
        sessionService.handleEvent(event);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/messages")
    public ResponseEntity<?> handleMessage(@RequestBody Map<String, String> payload) {
        Optional<DetectedEvent> event = sessionService.handleMessage(
            payload.getOrDefault("text", ""), payload.get("actor"));
        return event.<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.ok(Map.of("detected", false)));
    }

    @PostMapping("/epics")
    public ResponseEntity<?> createEpic(@RequestBody Map<String, String> payload) throws IOException {
        String planFile = payload.get("plan_file");
        if (planFile == null || planFile.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "plan_file is required"));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.createEpic(planFile));
    }

    @GetMapping("/epics")
    public ResponseEntity<?> listEpics() {
        return ResponseEntity.ok(sessionService.listEpics());
    }

    @PostMapping("/epics/{number}/status")
    public ResponseEntity<?> setStatus(@PathVariable int number, @RequestBody Map<String, String> payload) {
        Optional<EpicStatus> status = EpicStatus.fromValue(payload.get("status"));
        if (status.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown status: " + payload.get("status")));
        }
        return sessionService.setStatus(number, status.get(), payload.get("actor"))
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Epic #" + number + " is not tracked")));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    @ExceptionHandler(SessionNotStartedException.class)
    public ResponseEntity<?> handleNoSession(SessionNotStartedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler({InvalidTrackerConfigException.class, IllegalArgumentException.class})
    public ResponseEntity<?> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<?> handleUnreadableFile(IOException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "Cannot read file: " + e.getMessage()));
    }

    @ExceptionHandler(RemoteClientException.class)
    public ResponseEntity<?> handleRemoteFailure(RemoteClientException e) {
        log.error("GitHub operation '{}' failed: {}", e.getOperation(), e.getErrorOutput());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(CacheWriteException.class)
    public ResponseEntity<?> handleCacheWrite(CacheWriteException e) {
        log.error("Cache write failed", e);
        return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
    }
}
