package com.jsast.ast;

public record TryStatement<T extends CharSequence>(
    BlockStatement<T> block,
    CatchClause<T> handler,
    BlockStatement<T> finalizer
) implements Statement<T> {

    @Override
    public String type() {
        return "TryStatement";
    }
}
