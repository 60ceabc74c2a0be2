package com.jsast.ast;

public record ClassExpression<T extends CharSequence>(
    Identifier<T> id,
    Expression<T> superClass,
    ClassBody<T> body
) implements Expression<T> {

    @Override
    public String type() {
        return "ClassExpression";
    }
}
