package org.texpreview.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into plain text and math spans in a single left-to-right pass.
 * <p>
 * At every position display delimiters are tried before inline ones, so {@code $$x$$} is one
 * display span and never two empty inline spans. Escaped dollars ({@code \$}) are text, and an
 * opening delimiter without a closing one stays literal text.
 */
public final class MathScanner {

    private static final String[] EQUATION_NAMES = {"equation*", "equation"};

    private MathScanner() {}

    /**
     * Scans the text.
     * @param text The text to split.
     * @return The segments in source order; concatenating their sources yields the input.
     */
    public static List<MathSegment> scan(String text) {
        List<MathSegment> segments = new ArrayList<>();
        int textStart = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            Span span = null;
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == '$' || next == '\\') {
                    i += 2;
                    continue;
                }
                if (next == '[') {
                    span = delimited(text, i, "\\[", "\\]", MathSegment.Kind.DISPLAY);
                } else if (next == '(') {
                    span = delimited(text, i, "\\(", "\\)", MathSegment.Kind.INLINE);
                } else {
                    span = equation(text, i);
                }
            } else if (c == '$') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '$') {
                    span = delimited(text, i, "$$", "$$", MathSegment.Kind.DISPLAY);
                    if (span == null) {
                        i += 2;
                        continue;
                    }
                } else {
                    span = delimited(text, i, "$", "$", MathSegment.Kind.INLINE);
                }
            }

            if (span == null) {
                i++;
                continue;
            }
            if (i > textStart) {
                String plain = text.substring(textStart, i);
                segments.add(new MathSegment(MathSegment.Kind.TEXT, plain, plain));
            }
            segments.add(span.segment());
            i = span.end();
            textStart = i;
        }
        if (textStart < text.length()) {
            String plain = text.substring(textStart);
            segments.add(new MathSegment(MathSegment.Kind.TEXT, plain, plain));
        }
        return segments;
    }

    private static Span delimited(String text, int start, String open, String close, MathSegment.Kind kind) {
        int contentStart = start + open.length();
        int closeIdx = CommandScanner.indexOfUnescaped(text, close, contentStart);
        if (closeIdx < 0) return null;
        int end = closeIdx + close.length();
        return new Span(new MathSegment(kind, text.substring(contentStart, closeIdx), text.substring(start, end)), end);
    }

    private static Span equation(String text, int start) {
        for (String name : EQUATION_NAMES) {
            String open = "\\begin{" + name + "}";
            if (text.startsWith(open, start)) {
                return delimited(text, start, open, "\\end{" + name + "}", MathSegment.Kind.DISPLAY);
            }
        }
        return null;
    }

    private record Span(MathSegment segment, int end) {
    }
}
