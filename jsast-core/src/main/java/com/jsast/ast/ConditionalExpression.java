package com.jsast.ast;

/**
 * {@code consequent} is evaluated when {@code test} is truthy, {@code alternate} otherwise.
 */
public record ConditionalExpression<T extends CharSequence>(
    Expression<T> test,
    Expression<T> consequent,
    Expression<T> alternate
) implements Expression<T> {

    @Override
    public String type() {
        return "ConditionalExpression";
    }
}
