package com.invoice.mapping.controller;

import com.invoice.mapping.entity.ProcessingQueueItem;
import com.invoice.mapping.model.ProcessingPath;
import com.invoice.mapping.model.QueueStats;
import com.invoice.mapping.model.QueueStatus;
import com.invoice.mapping.model.ReviewSummary;
import com.invoice.mapping.service.ProcessingQueueService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Review backlog for the reviewer UI.
 */
@RestController
@RequestMapping("/api/queue")
@Slf4j
public class QueueController {

    private final ProcessingQueueService queueService;

    public QueueController(ProcessingQueueService queueService) {
        this.queueService = queueService;
    }

    @GetMapping
    public List<ProcessingQueueItem> list(@RequestParam(required = false) ProcessingPath path,
                                          @RequestParam(defaultValue = "PENDING") QueueStatus status,
                                          @RequestParam(defaultValue = "50") int limit) {
        return queueService.list(path, status, limit);
    }

    @GetMapping("/next")
    public ResponseEntity<ProcessingQueueItem> next(@RequestParam(required = false) ProcessingPath path) {
        return ResponseEntity.of(queueService.next(path));
    }

    @GetMapping("/stats")
    public QueueStats stats() {
        return queueService.stats();
    }

    @GetMapping("/{id}")
    public ProcessingQueueItem get(@PathVariable Long id) {
        return queueService.get(id);
    }

    @GetMapping("/reviewers/{reviewer}/in-progress")
    public Map<String, Long> inProgressCount(@PathVariable String reviewer) {
        return Map.of("inProgress", queueService.pendingCountFor(reviewer));
    }

    @PostMapping("/{id}/assign")
    public ProcessingQueueItem assign(@PathVariable Long id, @RequestBody @Valid AssignRequest request) {
        return queueService.assign(id, request.getReviewer());
    }

    @PostMapping("/{id}/complete")
    public ProcessingQueueItem complete(@PathVariable Long id, @RequestBody @Valid ReviewSummary review) {
        return queueService.complete(id, review);
    }

    @PostMapping("/{id}/skip")
    public ProcessingQueueItem skip(@PathVariable Long id, @RequestBody(required = false) CloseRequest request) {
        return queueService.skip(id, request == null ? null : request.getReason());
    }

    @PostMapping("/{id}/cancel")
    public ProcessingQueueItem cancel(@PathVariable Long id, @RequestBody(required = false) CloseRequest request) {
        return queueService.cancel(id, request == null ? null : request.getReason());
    }

    @Data
    public static class AssignRequest {
        @NotBlank
        private String reviewer;
    }

    @Data
    public static class CloseRequest {
        private String reason;
    }
}
