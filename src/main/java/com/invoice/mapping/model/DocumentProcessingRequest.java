package com.invoice.mapping.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentProcessingRequest {

    @NotBlank
    private String documentId;

    private String forwarderCode;        // null = identify from the OCR text

    @NotNull
    @Valid
    private OcrPayload payload;

    private Instant documentCreatedAt;   // null = received now
}
