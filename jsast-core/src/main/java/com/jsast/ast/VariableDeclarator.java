package com.jsast.ast;

public record VariableDeclarator<T extends CharSequence>(
    Pattern<T> id,
    Expression<T> init
) implements Node {

    @Override
    public String type() {
        return "VariableDeclarator";
    }
}
