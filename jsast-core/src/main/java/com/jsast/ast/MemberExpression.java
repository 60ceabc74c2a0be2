package com.jsast.ast;

public record MemberExpression<T extends CharSequence>(
    Expression<T> object,
    Expression<T> property,
    boolean computed
) implements Expression<T> {

    @Override
    public String type() {
        return "MemberExpression";
    }
}
