package com.jsast.ast;

public record CatchClause<T extends CharSequence>(
    Pattern<T> param,
    BlockStatement<T> body
) implements Node {

    @Override
    public String type() {
        return "CatchClause";
    }
}
