package com.jsast.ast;

public record ThrowStatement<T extends CharSequence>(
    Expression<T> argument
) implements Statement<T> {

    @Override
    public String type() {
        return "ThrowStatement";
    }
}
