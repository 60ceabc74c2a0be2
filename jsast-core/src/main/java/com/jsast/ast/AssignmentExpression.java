package com.jsast.ast;

public record AssignmentExpression<T extends CharSequence>(
    AssignOperator operator,
    AssignmentTarget<T> left,
    Expression<T> right
) implements Expression<T> {

    @Override
    public String type() {
        return "AssignmentExpression";
    }
}
