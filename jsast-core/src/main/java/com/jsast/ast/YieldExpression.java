package com.jsast.ast;

public record YieldExpression<T extends CharSequence>(
    Expression<T> argument,
    boolean delegate
) implements Expression<T> {

    @Override
    public String type() {
        return "YieldExpression";
    }
}
