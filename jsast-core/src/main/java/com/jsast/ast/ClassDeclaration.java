package com.jsast.ast;

public record ClassDeclaration<T extends CharSequence>(
    Identifier<T> id,
    Expression<T> superClass,
    ClassBody<T> body
) implements Declaration<T> {

    @Override
    public String type() {
        return "ClassDeclaration";
    }
}
