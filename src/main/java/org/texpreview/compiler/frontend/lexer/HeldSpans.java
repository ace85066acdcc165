package org.texpreview.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swaps spans of a text for private-use placeholders so that a rewrite pass cannot touch them,
 * and puts them back afterwards. One instance serves one pass.
 */
public final class HeldSpans {

    private static final char OPEN = '\uE000';
    private static final char CLOSE = '\uE001';
    private static final Pattern PLACEHOLDER = Pattern.compile(OPEN + "(\\d+)" + CLOSE);

    private final List<String> held = new ArrayList<>();

    /**
     * Holds back a span.
     * @param source The exact span text.
     * @return The placeholder standing for it.
     */
    public String hold(String source) {
        held.add(source);
        return OPEN + String.valueOf(held.size() - 1) + CLOSE;
    }

    /**
     * Holds back every math span of a text.
     * @param text The text.
     * @return The text with each math span replaced by a placeholder.
     */
    public String holdMath(String text) {
        StringBuilder masked = new StringBuilder(text.length());
        for (MathSegment segment : MathScanner.scan(text)) {
            masked.append(segment.isMath() ? hold(segment.source()) : segment.source());
        }
        return masked.toString();
    }

    /**
     * Puts every held span back in place of its placeholder.
     * @param text The rewritten text.
     * @return The text with the original spans.
     */
    public String restore(String text) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(held.get(Integer.parseInt(matcher.group(1)))));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * @return The number of spans held so far.
     */
    public int size() {
        return held.size();
    }
}
