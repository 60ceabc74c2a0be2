package com.jsast.ast;

/**
 * A numeric literal as written. Its numeric value is computed by the serializer.
 */
public record NumberLiteral<T extends CharSequence>(
    T raw
) implements Literal<T> {

    @Override
    public String type() {
        return "Literal";
    }
}
