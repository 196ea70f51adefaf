package com.invoice.mapping.service;

import com.invoice.mapping.config.IdentificationProperties;
import com.invoice.mapping.entity.Forwarder;
import com.invoice.mapping.model.ForwarderMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recognises which forwarder issued a document from its OCR text.
 *
 * Scoring per forwarder: a name match once, each keyword up to a cap, one
 * format regex match, and a small bonus for every matched pattern beyond the
 * first. The best forwarder at or above the threshold is taken.
 */
@Service
@Slf4j
public class ForwarderIdentificationService {

    private final RuleCatalogService catalogService;
    private final IdentificationProperties properties;

    public ForwarderIdentificationService(RuleCatalogService catalogService,
                                          IdentificationProperties properties) {
        this.catalogService = catalogService;
        this.properties = properties;
    }

    /**
     * Scores all active forwarders against the text. Returns the best one,
     * or empty if none reaches the threshold.
     */
    public Optional<ForwarderMatch> identify(String text) {
        if (text == null || text.isBlank()) {
            log.warn("No text to identify a forwarder from");
            return Optional.empty();
        }

        String normalized = normalize(text);
        ForwarderMatch best = null;

        // Ordered by priority, so the higher-priority forwarder keeps a tie
        for (Forwarder forwarder : catalogService.getActiveForwarders()) {
            ForwarderMatch match = score(forwarder, normalized, text);
            log.debug("Forwarder '{}' scored {} points", forwarder.getCode(), match.getScore());

            if (best == null || match.getScore() > best.getScore()) {
                best = match;
            }
        }

        if (best == null || best.getScore() < properties.getIdentifyThreshold()) {
            log.warn("No forwarder matched the document");
            return Optional.empty();
        }

        log.info("Identified forwarder: {} (score: {})", best.getForwarderCode(), best.getScore());
        return Optional.of(best);
    }

    ForwarderMatch score(Forwarder forwarder, String normalizedText, String originalText) {
        ForwarderMatch.ForwarderMatchBuilder match = ForwarderMatch.builder()
                .forwarderCode(forwarder.getCode())
                .forwarderName(forwarder.getDisplayName());
        double total = 0;
        int matched = 0;

        boolean nameMatched = false;
        for (String name : safe(forwarder.getNames())) {
            if (normalizedText.contains(normalize(name))) {
                if (!nameMatched) {
                    total += properties.getNameMatchScore();
                    nameMatched = true;
                }
                match.matchedPattern("name:" + name);
                matched++;
            }
        }

        double keywordScore = 0;
        for (String keyword : safe(forwarder.getKeywords())) {
            if (normalizedText.contains(normalize(keyword))) {
                double add = Math.min(properties.getKeywordMatchScore(),
                        properties.getKeywordMatchMax() - keywordScore);
                if (add > 0) {
                    keywordScore += add;
                    total += add;
                }
                match.matchedPattern("keyword:" + keyword);
                matched++;
            }
        }

        for (String format : safe(forwarder.getFormats())) {
            try {
                Pattern p = Pattern.compile(format, Pattern.CASE_INSENSITIVE);
                if (p.matcher(originalText).find()) {
                    total += properties.getFormatMatchScore();
                    match.matchedPattern("format:" + format);
                    matched++;
                    break;      // one format match counts
                }
            } catch (PatternSyntaxException e) {
                log.warn("Invalid format pattern for forwarder {}: {}", forwarder.getCode(), format);
            }
        }

        if (matched > 1) {
            total += (matched - 1) * properties.getBonusPerExtraMatch();
        }
        double score = Math.min(total, 100.0);

        return match
                .score(score)
                .identified(score >= properties.getIdentifyThreshold())
                .build();
    }

    private static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    private static List<String> safe(List<String> patterns) {
        return patterns == null ? List.of() : patterns;
    }
}
