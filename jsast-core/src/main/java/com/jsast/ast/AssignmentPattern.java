package com.jsast.ast;

public record AssignmentPattern<T extends CharSequence>(
    Pattern<T> left,
    Expression<T> right
) implements Pattern<T> {

    @Override
    public String type() {
        return "AssignmentPattern";
    }
}
