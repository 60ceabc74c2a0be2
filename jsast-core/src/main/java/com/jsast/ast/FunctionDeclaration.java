package com.jsast.ast;

import java.util.List;

public record FunctionDeclaration<T extends CharSequence>(
    Identifier<T> id,
    List<FunctionParameter<T>> params,
    FunctionBody<T> body,
    boolean generator,
    boolean async
) implements Declaration<T> {

    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
