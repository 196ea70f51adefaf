package com.invoice.mapping.service.matcher;

import com.invoice.mapping.config.ConfidenceProperties;
import com.invoice.mapping.exception.InvalidRuleException;
import com.invoice.mapping.model.CandidateMatch;
import com.invoice.mapping.model.ExtractionMethod;
import com.invoice.mapping.model.KeywordPattern;
import com.invoice.mapping.model.OcrPayload;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a label case-insensitively and returns the rest of its line, or the
 * part of it within {@code maxDistance} characters, with leading separators
 * stripped. Labels are tried in rule order; for each label, later occurrences
 * are tried when an earlier one has nothing after it.
 */
@Component
public class KeywordPatternMatcher implements PatternMatcher<KeywordPattern> {

    private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s:;=：]+");

    private final ConfidenceProperties properties;

    public KeywordPatternMatcher(ConfidenceProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<CandidateMatch> match(KeywordPattern rule, OcrPayload payload) {
        List<String> labels = rule.keywords().stream()
                .filter(k -> k != null && !k.isBlank())
                .toList();
        if (labels.isEmpty()) {
            throw new InvalidRuleException("Keyword rule has no keyword");
        }
        if (rule.maxDistance() != null && rule.maxDistance() < 1) {
            throw new InvalidRuleException("Keyword rule maxDistance must be positive: " + rule.maxDistance());
        }

        for (String label : labels) {
            Optional<CandidateMatch> found = matchLabel(label, rule, payload);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<CandidateMatch> matchLabel(String label, KeywordPattern rule, OcrPayload payload) {
        String text = payload.getText();
        Matcher m = Pattern.compile(Pattern.quote(label),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE).matcher(text);

        while (m.find()) {
            String remainder = restOfLine(text, m.end(), rule.maxDistance());
            remainder = LEADING_SEPARATORS.matcher(remainder).replaceFirst("");
            String value = rule.preprocessor().apply(remainder);
            if (value == null || value.isBlank()) {
                continue;
            }

            String sourceLine = LayoutLocator.lineAt(text, m.start());
            Optional<LayoutLocator.Location> location = LayoutLocator.locate(payload, sourceLine);

            return Optional.of(CandidateMatch.builder()
                    .value(value)
                    .sourceText(sourceLine)
                    .page(location.map(LayoutLocator.Location::page).orElse(null))
                    .position(location.map(LayoutLocator.Location::position).orElse(null))
                    .confidence(PatternMatcher.boosted(properties.getMethod().getKeyword(), rule.confidenceBoost()))
                    .method(ExtractionMethod.KEYWORD)
                    .build());
        }
        return Optional.empty();
    }

    private static String restOfLine(String text, int from, Integer maxDistance) {
        int limit = maxDistance == null ? text.length() : (int) Math.min(text.length(), (long) from + maxDistance);
        int end = from;
        while (end < limit && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
            end++;
        }
        return text.substring(from, end);
    }
}
