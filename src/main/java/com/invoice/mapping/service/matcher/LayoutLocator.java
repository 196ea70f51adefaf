package com.invoice.mapping.service.matcher;

import com.invoice.mapping.model.BoundingBox;
import com.invoice.mapping.model.OcrPayload;
import com.invoice.mapping.model.OcrPayload.OcrLine;
import com.invoice.mapping.model.OcrPayload.OcrPage;

import java.util.List;
import java.util.Optional;

/**
 * Finds where a piece of plain text sits in the page/line layout, for provenance.
 */
final class LayoutLocator {

    private LayoutLocator() {
    }

    record Location(int page, BoundingBox position) {
    }

    static Optional<Location> locate(OcrPayload payload, String snippet) {
        if (snippet == null || snippet.isBlank() || payload.getPages() == null) {
            return Optional.empty();
        }
        String needle = snippet.trim();
        for (OcrPage page : payload.getPages()) {
            List<OcrLine> lines = page.getLines();
            if (lines == null) continue;
            for (OcrLine line : lines) {
                if (line.getContent() != null && line.getContent().contains(needle)) {
                    return Optional.of(new Location(page.getPageNumber(),
                            BoundingBox.fromPolygon(line.getPolygon())));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * The full line of {@code text} containing offset {@code index}.
     */
    static String lineAt(String text, int index) {
        int start = text.lastIndexOf('\n', index - 1) + 1;
        int end = text.indexOf('\n', index);
        if (end < 0) end = text.length();
        return text.substring(start, end).replace("\r", "").trim();
    }
}
