package com.jsast.ast;

public record DoWhileStatement<T extends CharSequence>(
    Statement<T> body,
    Expression<T> test
) implements Statement<T> {

    @Override
    public String type() {
        return "DoWhileStatement";
    }
}
