package com.jsast.ast;

public record WithStatement<T extends CharSequence>(
    Expression<T> object,
    Statement<T> body
) implements Statement<T> {

    @Override
    public String type() {
        return "WithStatement";
    }
}
