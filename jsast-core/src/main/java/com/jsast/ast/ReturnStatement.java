package com.jsast.ast;

public record ReturnStatement<T extends CharSequence>(
    Expression<T> argument
) implements Statement<T> {

    @Override
    public String type() {
        return "ReturnStatement";
    }
}
