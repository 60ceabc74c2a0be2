package com.jsast.ast;

public record ForInStatement<T extends CharSequence>(
    ForLeft<T> left,
    Expression<T> right,
    Statement<T> body
) implements Statement<T> {

    @Override
    public String type() {
        return "ForInStatement";
    }
}
