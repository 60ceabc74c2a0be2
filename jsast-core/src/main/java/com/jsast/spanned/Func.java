package com.jsast.spanned;

import java.util.List;

/**
 * A {@code function}, either declared or used as an expression.
 */
public record Func<T extends CharSequence>(
    Token asyncKeyword,
    Token keyword,
    Token star,
    Ident<T> id,
    Token openParen,
    List<ListEntry<FuncArg<T>>> params,
    Token closeParen,
    FuncBody<T> body
) implements Decl<T>, Expr<T> {
    public Func {
        params = List.copyOf(params);
    }

    public boolean isAsync() {
        return asyncKeyword != null;
    }

    public boolean isGenerator() {
        return star != null;
    }
}
