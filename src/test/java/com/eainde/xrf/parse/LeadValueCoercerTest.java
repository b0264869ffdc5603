package com.eainde.xrf.parse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LeadValueCoercerTest {

    @Test
    @DisplayName("numbers pass through, negatives clamp to zero")
    void numbers() {
        assertThat(LeadValueCoercer.coerce(0.7).getAsDouble()).isEqualTo(0.7);
        assertThat(LeadValueCoercer.coerce(3).getAsDouble()).isEqualTo(3.0);
        assertThat(LeadValueCoercer.coerce(-0.2).getAsDouble()).isZero();
        assertThat(LeadValueCoercer.coerce(Double.NaN)).isEmpty();
    }

    @Test
    @DisplayName("TRUE is positive but never a calibration value, FALSE is zero")
    void booleans() {
        double positive = LeadValueCoercer.coerce(Boolean.TRUE).getAsDouble();

        assertThat(positive).isGreaterThanOrEqualTo(1.0).isNotIn(1.0, 1.1, 1.2);
        assertThat(LeadValueCoercer.coerce(Boolean.FALSE).getAsDouble()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {"POS", "Positive", "assumed", " Assumed Positive "})
    @DisplayName("positive tokens")
    void positiveTokens(String token) {
        assertThat(LeadValueCoercer.coerce(token).getAsDouble()).isEqualTo(LeadValueCoercer.POSITIVE_TOKEN_VALUE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"neg", "NEGATIVE", "n/a", "-"})
    @DisplayName("negative tokens")
    void negativeTokens(String token) {
        assertThat(LeadValueCoercer.coerce(token).getAsDouble()).isZero();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "1.3 mg/cm²|1.3",
            "0.4mg/cm2|0.4",
            "<0.1|0.1",
            ">5.0|5.0",
            "'1,200 ppm'|1200",
            "2.5 (high)|2.5"
    })
    @DisplayName("decorated numeric text")
    void decoratedText(String cell, double expected) {
        assertThat(LeadValueCoercer.coerce(cell).getAsDouble()).isCloseTo(expected, within(1e-9));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "abc", "see notes"})
    @DisplayName("text without a value")
    void unusable(String cell) {
        assertThat(LeadValueCoercer.coerce(cell)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"1e999", "-1e999 ppm"})
    @DisplayName("text overflowing a double has no value")
    void overflowingText(String cell) {
        assertThat(LeadValueCoercer.coerce(cell)).isEmpty();
    }

    @Test
    @DisplayName("null cell has no value")
    void nullCell() {
        assertThat(LeadValueCoercer.coerce(null)).isEmpty();
    }
}
