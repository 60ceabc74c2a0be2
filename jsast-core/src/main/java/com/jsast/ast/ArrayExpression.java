package com.jsast.ast;

import java.util.List;

/**
 * Elided elements are null entries of {@code elements}.
 */
public record ArrayExpression<T extends CharSequence>(
    List<Expression<T>> elements
) implements Expression<T> {

    @Override
    public String type() {
        return "ArrayExpression";
    }
}
