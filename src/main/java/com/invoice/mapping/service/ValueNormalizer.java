package com.invoice.mapping.service;

import com.invoice.mapping.model.StandardField.DataType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Normalizes raw values by field data type and checks them against a rule's
 * validation pattern. Values that cannot be normalized are returned trimmed.
 */
@Component
@Slf4j
public class ValueNormalizer {

    // Tried in order; the first that parses wins
    private static final List<DateFormat> NUMERIC_DATE_FORMATS = List.of(
            new DateFormat(Pattern.compile("\\d{4}-\\d{2}-\\d{2}"), strict("uuuu-MM-dd")),
            new DateFormat(Pattern.compile("\\d{4}/\\d{2}/\\d{2}"), strict("uuuu/MM/dd")),
            new DateFormat(Pattern.compile("\\d{2}/\\d{2}/\\d{4}"), strict("MM/dd/uuuu")),
            new DateFormat(Pattern.compile("\\d{2}-\\d{2}-\\d{4}"), strict("MM-dd-uuuu")),
            new DateFormat(Pattern.compile("\\d{2}\\.\\d{2}\\.\\d{4}"), strict("dd.MM.uuuu"))
    );

    private static final Pattern DAY_MONTH_YEAR = Pattern.compile(
            "(\\d{1,2})[\\s-]+(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.?[\\s-]+(\\d{4})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY_YEAR = Pattern.compile(
            "(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private static final Pattern WEIGHT_UNITS = Pattern.compile("(kgs|kg|lbs|lb|grams|gram|g)\\.?", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("-?[\\d.,]+");

    public String normalize(DataType dataType, String raw) {
        if (raw == null) return null;
        String value = raw.trim();
        if (value.isEmpty()) return value;

        String normalized = switch (dataType) {
            case DATE -> normalizeDate(value);
            case CURRENCY -> normalizeAmount(value);
            case WEIGHT -> normalizeWeight(value);
            default -> null;
        };
        return normalized != null ? normalized : value;
    }

    /**
     * @return {@code YYYY-MM-DD}, or null when no known format matches
     */
    public String normalizeDate(String value) {
        for (DateFormat format : NUMERIC_DATE_FORMATS) {
            Matcher m = format.pattern().matcher(value);
            if (m.find()) {
                try {
                    return LocalDate.parse(m.group(), format.formatter()).toString();
                } catch (DateTimeParseException e) {
                    log.debug("'{}' looks like {} but does not parse", value, format.pattern());
                }
            }
        }

        Matcher dmy = DAY_MONTH_YEAR.matcher(value);
        if (dmy.find()) {
            String date = textualDate(dmy.group(3), dmy.group(2), dmy.group(1));
            if (date != null) return date;
        }

        Matcher mdy = MONTH_DAY_YEAR.matcher(value);
        if (mdy.find()) {
            return textualDate(mdy.group(3), mdy.group(1), mdy.group(2));
        }
        return null;
    }

    /**
     * Strips currency symbols and thousands separators and returns the amount
     * with two decimals. When both separators appear, the last one is the
     * decimal separator; a lone comma followed by one or two digits is too.
     *
     * @return the plain amount, or null when the value holds no number
     */
    public String normalizeAmount(String value) {
        String cleaned = value.replaceAll("[^\\d.,\\-]", "");
        if (cleaned.isEmpty() || !cleaned.matches(".*\\d.*")) {
            return null;
        }

        int lastComma = cleaned.lastIndexOf(',');
        int lastDot = cleaned.lastIndexOf('.');

        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                cleaned = cleaned.replace(".", "").replace(',', '.');
            } else {
                cleaned = cleaned.replace(",", "");
            }
        } else if (lastComma >= 0) {
            String[] parts = cleaned.split(",", -1);
            if (parts.length == 2 && parts[1].length() >= 1 && parts[1].length() <= 2) {
                cleaned = cleaned.replace(',', '.');
            } else {
                cleaned = cleaned.replace(",", "");
            }
        } else if (cleaned.indexOf('.') != lastDot) {
            // 1.234.567 has only thousands separators
            cleaned = cleaned.replace(".", "");
        }

        try {
            return new BigDecimal(cleaned).setScale(2, RoundingMode.HALF_UP).toPlainString();
        } catch (NumberFormatException e) {
            log.debug("Could not normalize amount '{}'", value);
            return null;
        }
    }

    public String normalizeWeight(String value) {
        String withoutUnits = WEIGHT_UNITS.matcher(value).replaceAll("").trim();
        Matcher m = NUMBER.matcher(withoutUnits);
        return m.find() ? normalizeAmount(m.group()) : null;
    }

    /**
     * Checks a value against an optional validation regex, anchored at the
     * start of the value. A validation pattern that does not compile is
     * logged and treated as passing.
     */
    public Validation validate(String value, String validationPattern) {
        if (validationPattern == null || validationPattern.isBlank() || value == null) {
            return Validation.VALID;
        }
        try {
            if (Pattern.compile(validationPattern).matcher(value).lookingAt()) {
                return Validation.VALID;
            }
            return new Validation(false, "Value does not match pattern: " + validationPattern);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid validation pattern '{}': {}", validationPattern, e.getDescription());
            return Validation.VALID;
        }
    }

    private static String textualDate(String year, String month, String day) {
        Integer monthNumber = MONTHS.get(month.substring(0, 3).toLowerCase(Locale.ROOT));
        if (monthNumber == null) return null;
        try {
            return LocalDate.of(Integer.parseInt(year), monthNumber, Integer.parseInt(day)).toString();
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    private record DateFormat(Pattern pattern, DateTimeFormatter formatter) {
    }

    public record Validation(boolean valid, String message) {
        public static final Validation VALID = new Validation(true, null);
    }
}
