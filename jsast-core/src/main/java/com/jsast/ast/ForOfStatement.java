package com.jsast.ast;

public record ForOfStatement<T extends CharSequence>(
    ForLeft<T> left,
    Expression<T> right,
    Statement<T> body,
    boolean await
) implements Statement<T> {

    @Override
    public String type() {
        return "ForOfStatement";
    }
}
