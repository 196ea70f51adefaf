package com.invoice.mapping.controller;

import com.invoice.mapping.model.BatchProcessingResult;
import com.invoice.mapping.model.DocumentProcessingRequest;
import com.invoice.mapping.model.ProcessingOutcome;
import com.invoice.mapping.service.DocumentProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/documents")
@Slf4j
public class DocumentProcessingController {

    private final DocumentProcessingService processingService;

    public DocumentProcessingController(DocumentProcessingService processingService) {
        this.processingService = processingService;
    }

    /**
     * Maps, scores and routes one OCR'd document. The forwarder is identified
     * from the text when the body does not name one.
     */
    @PostMapping("/{documentId}/process")
    public ResponseEntity<ProcessingOutcome> process(@PathVariable String documentId,
                                                     @RequestBody DocumentProcessingRequest request) {
        request.setDocumentId(documentId);
        log.info("Processing document {}", documentId);
        return ResponseEntity.ok(processingService.process(request));
    }

    @PostMapping("/process-batch")
    public ResponseEntity<BatchProcessingResult> processBatch(
            @RequestBody List<DocumentProcessingRequest> requests) {
        return ResponseEntity.ok(processingService.processBatch(requests));
    }
}
