package org.texpreview.compiler.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class LengthsTest {

    @Test
    @Tag("unit")
    void pointsAreConvertedToCssPoints() {
        assertThat(Lengths.parse("12pt")).map(Lengths.Length::toCss).contains("11.96pt");
        assertThat(Lengths.parse("2cm")).map(Lengths.Length::toCss).contains("2cm");
        assertThat(Lengths.parse(" 1.5em ")).map(Lengths.Length::toCss).contains("1.5em");
    }

    @Test
    @Tag("unit")
    void unknownUnitsAreNotLengths() {
        assertThat(Lengths.parse("abc")).isEmpty();
        assertThat(Lengths.parse("3furlong")).isEmpty();
        assertThat(Lengths.parse("")).isEmpty();
    }

    @Test
    @Tag("unit")
    void textWidthFractionsMapToPercent() {
        assertThat(Lengths.toWidthPercent("0.45\\linewidth", 21).orElseThrow()).isCloseTo(45.0, within(1e-9));
        assertThat(Lengths.toWidthPercent("\\textwidth", 21)).contains(100.0);
    }

    @Test
    @Tag("unit")
    void absoluteWidthsAreMeasuredAgainstReferencePage() {
        assertThat(Lengths.toWidthPercent("10.5cm", 21).orElseThrow()).isCloseTo(50.0, within(1e-9));
        assertThat(Lengths.toWidthPercent("105mm", 21).orElseThrow()).isCloseTo(50.0, within(1e-9));
        assertThat(Lengths.toWidthPercent("2em", 21)).isEmpty();
    }

    @Test
    @Tag("unit")
    void formatKeepsAtMostTwoDecimals() {
        assertThat(Lengths.format(33.3333)).isEqualTo("33.33");
        assertThat(Lengths.format(50.0)).isEqualTo("50");
        assertThat(Lengths.format(0.125)).isEqualTo("0.13");
    }
}
