package com.jsast.ast;

public record UpdateExpression<T extends CharSequence>(
    UpdateOperator operator,
    Expression<T> argument,
    boolean prefix
) implements Expression<T> {

    @Override
    public String type() {
        return "UpdateExpression";
    }
}
