package com.jsast.ast;

public record ForStatement<T extends CharSequence>(
    ForInit<T> init,
    Expression<T> test,
    Expression<T> update,
    Statement<T> body
) implements Statement<T> {

    @Override
    public String type() {
        return "ForStatement";
    }
}
