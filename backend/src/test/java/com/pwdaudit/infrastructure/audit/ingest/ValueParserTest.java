package com.pwdaudit.infrastructure.audit.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueParserTest {

    @Nested
    @DisplayName("Dates")
    class DateTests {
        private final LocalDate expected = LocalDate.of(2024, 3, 31);

        @Test
        void iso_date() {
            assertThat(ValueParser.date("2024-03-31")).isEqualTo(expected);
        }

        @Test
        void day_first_formats() {
            assertThat(ValueParser.date("31-03-2024")).isEqualTo(expected);
            assertThat(ValueParser.date("31/3/2024")).isEqualTo(expected);
            assertThat(ValueParser.date("31.03.2024")).isEqualTo(expected);
        }

        @Test
        void date_time_export() {
            assertThat(ValueParser.date("2024-03-31 00:00:00")).isEqualTo(expected);
        }

        @Test
        void sheet_serial_number() {
            assertThat(ValueParser.date(45382)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Epoch milliseconds and other out-of-range serials are rejected, not thrown through")
        void serial_out_of_range_rejected() {
            assertThatThrownBy(() -> ValueParser.date(1_700_000_000_000L))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("out of range");
            assertThatThrownBy(() -> ValueParser.date(0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ValueParser.date(Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(ValueParser.date(2_958_465)).isEqualTo(LocalDate.of(9999, 12, 31));
        }

        @Test
        void impossible_date_rejected() {
            assertThatThrownBy(() -> ValueParser.date("31-02-2024"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("impossible date");
        }

        @Test
        void garbage_rejected() {
            assertThatThrownBy(() -> ValueParser.date("next March"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void placeholders_are_empty() {
            assertThat(ValueParser.date("-")).isNull();
            assertThat(ValueParser.date("N/A")).isNull();
            assertThat(ValueParser.date(null)).isNull();
        }
    }

    @Nested
    @DisplayName("Numbers")
    class NumberTests {
        @Test
        void thousands_separators_stripped() {
            assertThat(ValueParser.decimal("1,23,456.50")).isEqualByComparingTo("123456.50");
        }

        @Test
        void numeric_cells_pass_through() {
            assertThat(ValueParser.decimal(12.5)).isEqualByComparingTo("12.5");
            assertThat(ValueParser.decimal(7)).isEqualByComparingTo("7");
        }

        @Test
        void non_number_rejected() {
            assertThatThrownBy(() -> ValueParser.decimal("twelve"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not a number");
        }

        @Test
        void integer_requires_whole_number() {
            assertThat(ValueParser.integer("365.0")).isEqualTo(365);
            assertThatThrownBy(() -> ValueParser.integer("12.5"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void nil_is_empty() {
            assertThat(ValueParser.decimal("nil")).isNull();
        }
    }

    @Nested
    @DisplayName("Yes/no")
    class BooleanTests {
        @Test
        void english_words() {
            assertThat(ValueParser.bool("Yes")).isTrue();
            assertThat(ValueParser.bool("N")).isFalse();
            assertThat(ValueParser.bool(true)).isTrue();
        }

        @Test
        void marathi_words() {
            assertThat(ValueParser.bool("होय")).isTrue();
            assertThat(ValueParser.bool("नाही")).isFalse();
        }

        @Test
        void unknown_word_rejected() {
            assertThatThrownBy(() -> ValueParser.bool("maybe"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void text_is_trimmed() {
        assertThat(ValueParser.text("  SH-12  ")).isEqualTo("SH-12");
        assertThat(ValueParser.text("--")).isNull();
    }
}
