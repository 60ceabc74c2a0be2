package com.jsast.ast;

public record BinaryExpression<T extends CharSequence>(
    BinaryOperator operator,
    Expression<T> left,
    Expression<T> right
) implements Expression<T> {

    @Override
    public String type() {
        return "BinaryExpression";
    }
}
