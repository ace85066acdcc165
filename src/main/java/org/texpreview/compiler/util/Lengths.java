package org.texpreview.compiler.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion of markup lengths ({@code 2cm}, {@code 0.5\textwidth}) into CSS values.
 */
public final class Lengths {

    private static final Pattern ABSOLUTE = Pattern.compile("^\\s*(-?\\d*\\.?\\d+)\\s*(cm|mm|in|pt|bp|px|em|ex)\\s*$");
    private static final Pattern RELATIVE = Pattern.compile("^\\s*(\\d*\\.?\\d+)?\\s*\\\\(textwidth|linewidth|columnwidth|hsize)\\s*$");

    private Lengths() {}

    /**
     * A length with a recognized unit.
     *
     * @param value The numeric value.
     * @param unit  The unit, one of cm, mm, in, pt, bp, px, em, ex.
     */
    public record Length(double value, String unit) {

        /**
         * @return The length as a CSS value. Markup points ({@code pt}) are 1/72.27 inch and
         *         big points ({@code bp}) are CSS points.
         */
        public String toCss() {
            return switch (unit) {
                case "pt" -> format(value * 72.0 / 72.27) + "pt";
                case "bp" -> format(value) + "pt";
                default -> format(value) + unit;
            };
        }

        /**
         * @return The length in centimeters, or empty for font-relative units.
         */
        public Optional<Double> toCentimeters() {
            return switch (unit) {
                case "cm" -> Optional.of(value);
                case "mm" -> Optional.of(value / 10.0);
                case "in" -> Optional.of(value * 2.54);
                case "pt" -> Optional.of(value * 2.54 / 72.27);
                case "bp" -> Optional.of(value * 2.54 / 72.0);
                case "px" -> Optional.of(value * 2.54 / 96.0);
                default -> Optional.empty();
            };
        }
    }

    /**
     * Parses an absolute or font-relative length.
     * @param text The length text, e.g. {@code 1.5cm}.
     * @return The length, or empty if the text is not a plain length.
     */
    public static Optional<Length> parse(String text) {
        Matcher m = ABSOLUTE.matcher(text);
        if (!m.matches()) return Optional.empty();
        return Optional.of(new Length(Double.parseDouble(m.group(1)), m.group(2)));
    }

    /**
     * Parses a fraction of the text width such as {@code 0.45\linewidth}.
     * @param text The width text.
     * @return The fraction (1.0 for a bare {@code \textwidth}), or empty.
     */
    public static Optional<Double> parseTextWidthFraction(String text) {
        Matcher m = RELATIVE.matcher(text);
        if (!m.matches()) return Optional.empty();
        return Optional.of(m.group(1) == null ? 1.0 : Double.parseDouble(m.group(1)));
    }

    /**
     * Converts a width argument to a percentage of the text width. Fractions of the text width map
     * directly; absolute lengths are measured against the reference page width.
     * @param text The width argument.
     * @param referenceWidthCm The reference page width in centimeters.
     * @return The percentage, or empty if the argument is not recognized.
     */
    public static Optional<Double> toWidthPercent(String text, double referenceWidthCm) {
        Optional<Double> fraction = parseTextWidthFraction(text);
        if (fraction.isPresent()) {
            return Optional.of(fraction.get() * 100.0);
        }
        return parse(text)
                .flatMap(Length::toCentimeters)
                .map(cm -> cm / referenceWidthCm * 100.0);
    }

    /**
     * Formats a number with at most two decimals and no trailing zeros.
     * @param value The number.
     * @return The formatted number, e.g. {@code 50} or {@code 33.33}.
     */
    public static String format(double value) {
        return BigDecimal.valueOf(value)
                .setScale(2, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }
}
