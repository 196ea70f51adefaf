package com.invoice.mapping.service;

import com.invoice.mapping.model.StandardField.DataType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ValueNormalizer")
class ValueNormalizerTest {

    private final ValueNormalizer normalizer = new ValueNormalizer();

    @Nested
    @DisplayName("Dates")
    class Dates {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "2024-03-15           | 2024-03-15",
                "2024/03/15           | 2024-03-15",
                "03/15/2024           | 2024-03-15",
                "03-15-2024           | 2024-03-15",
                "15.03.2024           | 2024-03-15",
                "15 Mar 2024          | 2024-03-15",
                "5 September 2024     | 2024-09-05",
                "Mar 15, 2024         | 2024-03-15",
                "Date: 2024-03-15 UTC | 2024-03-15"
        })
        @DisplayName("Should normalize known formats to ISO dates")
        void shouldNormalizeKnownFormats(String raw, String expected) {
            assertThat(normalizer.normalize(DataType.DATE, raw)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should keep impossible or unknown dates as written")
        void shouldKeepUnparseableDates() {
            assertThat(normalizer.normalize(DataType.DATE, "02/30/2024")).isEqualTo("02/30/2024");
            assertThat(normalizer.normalize(DataType.DATE, "  next Tuesday ")).isEqualTo("next Tuesday");
        }
    }

    @Nested
    @DisplayName("Amounts")
    class Amounts {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "$1,234.56      | 1234.56",
                "EUR 1.234,56   | 1234.56",
                "1234,5         | 1234.50",
                "1,234          | 1234.00",
                "1.234.567      | 1234567.00",
                "USD 99         | 99.00",
                "-12.345        | -12.35"
        })
        @DisplayName("Should strip symbols and separators")
        void shouldNormalizeAmounts(String raw, String expected) {
            assertThat(normalizer.normalize(DataType.CURRENCY, raw)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should keep values without digits")
        void shouldKeepNonNumeric() {
            assertThat(normalizer.normalize(DataType.CURRENCY, "N/A")).isEqualTo("N/A");
        }
    }

    @Test
    @DisplayName("Should strip weight units")
    void shouldNormalizeWeights() {
        assertThat(normalizer.normalize(DataType.WEIGHT, "1,250.5 KGS")).isEqualTo("1250.50");
        assertThat(normalizer.normalize(DataType.WEIGHT, "12 lb")).isEqualTo("12.00");
    }

    @Test
    @DisplayName("Should only trim other data types")
    void shouldTrimStrings() {
        assertThat(normalizer.normalize(DataType.STRING, "  INV-1 ")).isEqualTo("INV-1");
        assertThat(normalizer.normalize(DataType.STRING, null)).isNull();
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should pass values matching the pattern")
        void shouldPassMatchingValue() {
            assertThat(normalizer.validate("INV-2024-001", "^INV-\\d{4}-\\d{3}$").valid()).isTrue();
        }

        @Test
        @DisplayName("Should fail with a message when the pattern does not match")
        void shouldFailNonMatchingValue() {
            ValueNormalizer.Validation result = normalizer.validate("ABC", "^\\d+$");

            assertThat(result.valid()).isFalse();
            assertThat(result.message()).contains("^\\d+$");
        }

        @Test
        @DisplayName("Should pass when there is no pattern or it does not compile")
        void shouldPassWithoutUsablePattern() {
            assertThat(normalizer.validate("x", null).valid()).isTrue();
            assertThat(normalizer.validate("x", "  ").valid()).isTrue();
            assertThat(normalizer.validate("x", "([a-z").valid()).isTrue();
        }
    }
}
