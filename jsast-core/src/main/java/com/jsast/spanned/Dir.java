package com.jsast.spanned;

/**
 * A directive the producer already recognized, such as {@code "use strict";}.
 */
public record Dir<T extends CharSequence>(StringLit<T> expr, Token semicolon) implements ProgramPart<T> {

    /**
     * The directive text: the literal's content exactly as written, without quotes.
     */
    public T dir() {
        return expr.content().source();
    }
}
