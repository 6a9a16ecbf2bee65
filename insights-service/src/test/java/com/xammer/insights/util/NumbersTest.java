package com.xammer.insights.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NumbersTest {

    @Test
    void display_dropsFractionForWholeValues() {
        assertThat(Numbers.display(90.0)).isEqualTo("90");
        assertThat(Numbers.display(0.0)).isEqualTo("0");
        assertThat(Numbers.display(-12.0)).isEqualTo("-12");
    }

    @Test
    void display_keepsFractionalDigits() {
        assertThat(Numbers.display(52.5)).isEqualTo("52.5");
        assertThat(Numbers.display(0.1 + 0.2)).isEqualTo("0.30000000000000004");
    }
}
