package com.jsast.ast;

/**
 * {@code flags} is null when the literal has none.
 */
public record RegExpLiteral<T extends CharSequence>(
    T pattern,
    T flags
) implements Literal<T> {

    @Override
    public String type() {
        return "Literal";
    }
}
