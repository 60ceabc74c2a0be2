package com.jsast.ast;

public record BooleanLiteral<T extends CharSequence>(
    boolean value
) implements Literal<T> {

    @Override
    public String type() {
        return "Literal";
    }
}
