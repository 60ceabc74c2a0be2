package com.jsast.ast;

/**
 * {@code content} is the text between the quotes, escapes untouched.
 */
public record StringLiteral<T extends CharSequence>(
    QuoteKind quote,
    T content
) implements Literal<T> {

    @Override
    public String type() {
        return "Literal";
    }
}
