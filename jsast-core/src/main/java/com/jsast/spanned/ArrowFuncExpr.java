package com.jsast.spanned;

import java.util.List;

/**
 * {@code async (a, b) => body}. A lone unparenthesized parameter has no parens.
 */
public record ArrowFuncExpr<T extends CharSequence>(
    Token asyncKeyword,
    Token openParen,
    List<ListEntry<FuncArg<T>>> params,
    Token closeParen,
    Token arrow,
    ArrowFuncBody<T> body
) implements Expr<T> {
    public ArrowFuncExpr {
        params = List.copyOf(params);
    }
}
