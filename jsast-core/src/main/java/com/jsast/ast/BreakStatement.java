package com.jsast.ast;

public record BreakStatement<T extends CharSequence>(
    Identifier<T> label
) implements Statement<T> {

    @Override
    public String type() {
        return "BreakStatement";
    }
}
