package com.jsast.spanned;

public record VarDecl<T extends CharSequence>(Pat<T> id, Token eq, Expr<T> init) implements Node {

    public VarDecl(Pat<T> id) {
        this(id, null, null);
    }
}
