package com.invoice.mapping.service.matcher;

import com.invoice.mapping.config.ConfidenceProperties;
import com.invoice.mapping.exception.InvalidRuleException;
import com.invoice.mapping.model.BoundingBox;
import com.invoice.mapping.model.CandidateMatch;
import com.invoice.mapping.model.ExtractionMethod;
import com.invoice.mapping.model.OcrPayload;
import com.invoice.mapping.model.OcrPayload.OcrLine;
import com.invoice.mapping.model.OcrPayload.OcrPage;
import com.invoice.mapping.model.PositionPattern;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a 1-based {@code page:row[:col]} selector against the OCR layout.
 * Columns are table cells separated by a tab or two or more spaces.
 * Anything out of range is a no-match.
 */
@Component
public class PositionPatternMatcher implements PatternMatcher<PositionPattern> {

    private static final Pattern SELECTOR = Pattern.compile("^\\s*(\\d+)\\s*:\\s*(\\d+)\\s*(?::\\s*(\\d+)\\s*)?$");
    private static final Pattern CELL_SEPARATOR = Pattern.compile("\\t|\\s{2,}");

    private final ConfidenceProperties properties;

    public PositionPatternMatcher(ConfidenceProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<CandidateMatch> match(PositionPattern rule, OcrPayload payload) {
        Selector selector = parse(rule.selector());

        List<OcrPage> pages = payload.getPages();
        if (pages == null || selector.page() < 1 || selector.page() > pages.size()) {
            return Optional.empty();
        }
        OcrPage page = pages.get(selector.page() - 1);
        List<OcrLine> lines = page.getLines();
        if (lines == null || selector.row() < 1 || selector.row() > lines.size()) {
            return Optional.empty();
        }
        OcrLine line = lines.get(selector.row() - 1);
        String content = line.getContent();
        if (content == null) {
            return Optional.empty();
        }

        String value = content.trim();
        if (selector.column() != null) {
            String[] cells = CELL_SEPARATOR.split(value);
            if (selector.column() < 1 || selector.column() > cells.length) {
                return Optional.empty();
            }
            value = cells[selector.column() - 1].trim();
        }
        if (value.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(CandidateMatch.builder()
                .value(value)
                .sourceText(content.trim())
                .page(page.getPageNumber())
                .position(BoundingBox.fromPolygon(line.getPolygon()))
                .confidence(properties.getMethod().getPosition())
                .method(ExtractionMethod.POSITION)
                .build());
    }

    static Selector parse(String selector) {
        if (selector == null) {
            throw new InvalidRuleException("Position rule has no selector");
        }
        Matcher m = SELECTOR.matcher(selector);
        if (!m.matches()) {
            throw new InvalidRuleException("Malformed position selector '" + selector + "', expected page:row[:col]");
        }
        try {
            Integer column = m.group(3) == null ? null : Integer.valueOf(m.group(3));
            return new Selector(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), column);
        } catch (NumberFormatException e) {
            throw new InvalidRuleException("Position selector index too large: '" + selector + "'", e);
        }
    }

    record Selector(int page, int row, Integer column) {
    }
}
