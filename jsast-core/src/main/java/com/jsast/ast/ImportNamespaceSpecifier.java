package com.jsast.ast;

public record ImportNamespaceSpecifier<T extends CharSequence>(
    Identifier<T> local
) implements ImportClause<T> {

    @Override
    public String type() {
        return "ImportNamespaceSpecifier";
    }
}
