package com.jsast.ast;

public record LogicalExpression<T extends CharSequence>(
    LogicalOperator operator,
    Expression<T> left,
    Expression<T> right
) implements Expression<T> {

    @Override
    public String type() {
        return "LogicalExpression";
    }
}
