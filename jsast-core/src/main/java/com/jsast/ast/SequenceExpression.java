package com.jsast.ast;

import java.util.List;

public record SequenceExpression<T extends CharSequence>(
    List<Expression<T>> expressions
) implements Expression<T> {

    @Override
    public String type() {
        return "SequenceExpression";
    }
}
