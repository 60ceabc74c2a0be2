package com.jsast.spanned;

import java.util.List;

public record CallExpr<T extends CharSequence>(
    Expr<T> callee,
    Token openParen,
    List<ListEntry<Expr<T>>> arguments,
    Token closeParen
) implements Expr<T> {
    public CallExpr {
        arguments = List.copyOf(arguments);
    }
}
