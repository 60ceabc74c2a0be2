package com.jsast.spanned;

import java.util.List;

/**
 * {@code new Callee(args)}; the argument parens are optional.
 */
public record NewExpr<T extends CharSequence>(
    Token keyword,
    Expr<T> callee,
    Token openParen,
    List<ListEntry<Expr<T>>> arguments,
    Token closeParen
) implements Expr<T> {
    public NewExpr {
        arguments = arguments == null ? null : List.copyOf(arguments);
    }
}
