package com.reliabledownloader.controllers;

import com.reliabledownloader.models.DownloadProgress;
import com.reliabledownloader.models.DownloadRequest;
import com.reliabledownloader.services.DownloadJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

// DownloadController.java
@RestController
@RequestMapping("/api/downloads")
@Slf4j
public class DownloadController {

    private final DownloadJobService downloadJobService;

    public DownloadController(DownloadJobService downloadJobService) {
        this.downloadJobService = downloadJobService;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> startDownload(@RequestBody DownloadRequest request) {
        DownloadJobService.Job job = downloadJobService.start(request);

        log.info("Started download: {} -> {} (ID: {})", request.url(), request.destinationPath(), job.downloadId());

        Map<String, String> response = new HashMap<>();
        response.put("downloadId", job.downloadId());
        response.put("status", "STARTED");
        response.put("message", "Download started successfully");

        return ResponseEntity.accepted().body(response);
    }

    @GetMapping("/{downloadId}")
    public ResponseEntity<DownloadProgress> getProgress(@PathVariable String downloadId) {
        DownloadProgress progress = downloadJobService.getProgress(downloadId);

        if (progress == null) {
            return ResponseEntity.notFound().build();
        }

        return ResponseEntity.ok(progress);
    }

    @GetMapping
    public ResponseEntity<Map<String, DownloadProgress>> getAllProgress() {
        return ResponseEntity.ok(downloadJobService.getAllProgress());
    }

    @DeleteMapping("/{downloadId}")
    public ResponseEntity<Map<String, String>> cancelDownload(@PathVariable String downloadId) {
        if (!downloadJobService.cancel(downloadId)) {
            return ResponseEntity.notFound().build();
        }

        Map<String, String> response = new HashMap<>();
        response.put("downloadId", downloadId);
        response.put("status", DownloadProgress.CANCELLING);
        response.put("message", "Cancellation requested");
        return ResponseEntity.accepted().body(response);
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, String>> handleRejected(TaskRejectedException e) {
        Map<String, String> response = new HashMap<>();
        response.put("error", "Too many downloads in progress, try again later");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected download request: {}", e.getMessage());
        Map<String, String> response = new HashMap<>();
        response.put("error", e.getMessage());
        return ResponseEntity.badRequest().body(response);
    }
}
