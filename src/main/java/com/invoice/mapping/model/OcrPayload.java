package com.invoice.mapping.model;

import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the external OCR/AI service returns for one document: the plain text,
 * a page/line layout, and the fields the service extracted on its own.
 * Treated as immutable for the duration of a mapping run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcrPayload {

    private String text;

    @Builder.Default
    private List<OcrPage> pages = new ArrayList<>();

    @Builder.Default
    private Map<String, PretrainedField> pretrainedFields = new LinkedHashMap<>();

    /**
     * Builds a single-page layout from plain text, one layout line per text line.
     */
    public static OcrPayload fromText(String text) {
        List<OcrLine> lines = new ArrayList<>();
        for (String line : text.split("\\r?\\n")) {
            lines.add(new OcrLine(line, List.of()));
        }
        return OcrPayload.builder()
                .text(text)
                .pages(new ArrayList<>(List.of(new OcrPage(1, lines))))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OcrPage {
        private int pageNumber;
        private List<OcrLine> lines = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OcrLine {
        private String content;
        /** Flat x1,y1,x2,y2,... polygon; may be empty. */
        private List<Double> polygon = new ArrayList<>();
    }

    /**
     * A value the OCR service extracted itself. Confidence is in 0..1.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PretrainedField {
        private String value;
        private Double confidence;
    }
}
