package com.jsast.ast;

public record AwaitExpression<T extends CharSequence>(
    Expression<T> argument
) implements Expression<T> {

    @Override
    public String type() {
        return "AwaitExpression";
    }
}
