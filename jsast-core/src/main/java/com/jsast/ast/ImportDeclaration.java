package com.jsast.ast;

import java.util.List;

public record ImportDeclaration<T extends CharSequence>(
    List<ImportClause<T>> specifiers,
    StringLiteral<T> source
) implements Declaration<T> {

    @Override
    public String type() {
        return "ImportDeclaration";
    }
}
