package com.jsast.ast;

public record ExpressionStatement<T extends CharSequence>(
    Expression<T> expression
) implements Statement<T> {

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
