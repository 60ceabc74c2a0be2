package com.jsast.ast;

public record IfStatement<T extends CharSequence>(
    Expression<T> test,
    Statement<T> consequent,
    Statement<T> alternate
) implements Statement<T> {

    @Override
    public String type() {
        return "IfStatement";
    }
}
