package com.jsast.ast;

import java.util.List;

public record CallExpression<T extends CharSequence>(
    Expression<T> callee,
    List<Expression<T>> arguments
) implements Expression<T> {

    @Override
    public String type() {
        return "CallExpression";
    }
}
