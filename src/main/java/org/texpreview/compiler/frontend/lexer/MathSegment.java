package org.texpreview.compiler.frontend.lexer;

/**
 * One piece of a document split by the {@link MathScanner}.
 *
 * @param kind    Whether the piece is plain text, a display span or an inline span.
 * @param content For math spans, the formula between the delimiters; for text, the text itself.
 * @param source  The exact source of the piece, delimiters included.
 */
public record MathSegment(Kind kind, String content, String source) {

    /**
     * The kind of a segment.
     */
    public enum Kind {
        /** Text outside any math span. */
        TEXT,
        /** A display span: {@code $$..$$}, {@code \[..\]} or an equation environment. */
        DISPLAY,
        /** An inline span: {@code $..$} or {@code \(..\)}. */
        INLINE
    }

    /**
     * @return {@code true} for display and inline spans.
     */
    public boolean isMath() {
        return kind != Kind.TEXT;
    }
}
