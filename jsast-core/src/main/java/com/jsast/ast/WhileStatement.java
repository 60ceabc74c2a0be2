package com.jsast.ast;

public record WhileStatement<T extends CharSequence>(
    Expression<T> test,
    Statement<T> body
) implements Statement<T> {

    @Override
    public String type() {
        return "WhileStatement";
    }
}
