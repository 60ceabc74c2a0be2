package com.jsast.ast;

public record Identifier<T extends CharSequence>(
    T name
) implements Expression<T>, Pattern<T> {

    @Override
    public String type() {
        return "Identifier";
    }
}
