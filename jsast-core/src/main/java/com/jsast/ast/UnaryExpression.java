package com.jsast.ast;

public record UnaryExpression<T extends CharSequence>(
    UnaryOperator operator,
    boolean prefix,
    Expression<T> argument
) implements Expression<T> {

    @Override
    public String type() {
        return "UnaryExpression";
    }
}
