package com.jsast.spanned;

import com.jsast.ast.QuoteKind;

/**
 * A quoted string. {@code content} is the text between the quotes, escapes untouched.
 */
public record StringLit<T extends CharSequence>(Token openQuote, Slice<T> content, Token closeQuote) implements Lit<T> {

    /**
     * A single-line string starting at the given column, opening quote included.
     */
    public static <T extends CharSequence> StringLit<T> of(QuoteKind quote, T content, int line, int column) {
        TokenKind kind = quote == QuoteKind.SINGLE ? TokenKind.SINGLE_QUOTE : TokenKind.DOUBLE_QUOTE;
        return new StringLit<>(
            Token.of(kind, line, column),
            Slice.of(content, line, column + 1),
            Token.of(kind, line, column + 1 + content.length()));
    }

    public QuoteKind quote() {
        return openQuote.is(TokenKind.SINGLE_QUOTE) ? QuoteKind.SINGLE : QuoteKind.DOUBLE;
    }
}
