package com.invoice.mapping.service.matcher;

import com.invoice.mapping.config.ConfidenceProperties;
import com.invoice.mapping.exception.InvalidRuleException;
import com.invoice.mapping.model.CandidateMatch;
import com.invoice.mapping.model.ExtractionMethod;
import com.invoice.mapping.model.OcrPayload;
import com.invoice.mapping.model.RegexPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Component
@Slf4j
public class RegexPatternMatcher implements PatternMatcher<RegexPattern> {

    private final ConfidenceProperties properties;

    public RegexPatternMatcher(ConfidenceProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<CandidateMatch> match(RegexPattern rule, OcrPayload payload) {
        Pattern compiled = compile(rule);
        String text = payload.getText();

        Matcher m = compiled.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }

        int group = resolveGroup(rule, m);
        String captured = m.group(group);
        if (captured == null) {
            return Optional.empty();
        }

        String value = rule.preprocessor().apply(captured);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }

        String sourceLine = LayoutLocator.lineAt(text, m.start());
        Optional<LayoutLocator.Location> location = LayoutLocator.locate(payload, m.group(0));

        return Optional.of(CandidateMatch.builder()
                .value(value)
                .sourceText(sourceLine)
                .page(location.map(LayoutLocator.Location::page).orElse(null))
                .position(location.map(LayoutLocator.Location::position).orElse(null))
                .confidence(PatternMatcher.boosted(properties.getMethod().getRegex(), rule.confidenceBoost()))
                .method(ExtractionMethod.REGEX)
                .build());
    }

    private Pattern compile(RegexPattern rule) {
        if (rule.pattern() == null || rule.pattern().isEmpty()) {
            throw new InvalidRuleException("Regex rule has no pattern");
        }
        try {
            return Pattern.compile(rule.pattern(), flagsOf(rule.flags()));
        } catch (PatternSyntaxException e) {
            throw new InvalidRuleException("Invalid regex '" + rule.pattern() + "': " + e.getDescription(), e);
        }
    }

    // Without an explicit group, the first capture group is the value if the pattern has one
    private int resolveGroup(RegexPattern rule, Matcher m) {
        if (rule.group() == null) {
            return m.groupCount() > 0 ? 1 : 0;
        }
        if (rule.group() < 0 || rule.group() > m.groupCount()) {
            throw new InvalidRuleException("Capture group " + rule.group()
                    + " does not exist in '" + rule.pattern() + "'");
        }
        return rule.group();
    }

    static int flagsOf(String flags) {
        int result = 0;
        for (char c : flags.toCharArray()) {
            switch (Character.toLowerCase(c)) {
                case 'i' -> result |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                case 'm' -> result |= Pattern.MULTILINE;
                case 's' -> result |= Pattern.DOTALL;
                default -> log.debug("Ignoring unsupported regex flag '{}'", c);
            }
        }
        return result;
    }
}
