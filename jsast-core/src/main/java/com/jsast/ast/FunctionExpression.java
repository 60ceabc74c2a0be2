package com.jsast.ast;

import java.util.List;

public record FunctionExpression<T extends CharSequence>(
    Identifier<T> id,
    List<FunctionParameter<T>> params,
    FunctionBody<T> body,
    boolean generator,
    boolean async
) implements Expression<T> {

    @Override
    public String type() {
        return "FunctionExpression";
    }
}
