package com.jsast.ast;

public record ImportDefaultSpecifier<T extends CharSequence>(
    Identifier<T> local
) implements ImportClause<T> {

    @Override
    public String type() {
        return "ImportDefaultSpecifier";
    }
}
