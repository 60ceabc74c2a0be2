package com.jsast.ast;

public record ContinueStatement<T extends CharSequence>(
    Identifier<T> label
) implements Statement<T> {

    @Override
    public String type() {
        return "ContinueStatement";
    }
}
