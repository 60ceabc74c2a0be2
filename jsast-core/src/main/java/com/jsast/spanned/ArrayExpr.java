package com.jsast.spanned;

import java.util.List;

/**
 * {@code [a, , ...b]}. Elided elements are entries with a {@code null} item.
 */
public record ArrayExpr<T extends CharSequence>(
    Token openBracket,
    List<ListEntry<Expr<T>>> elements,
    Token closeBracket
) implements Expr<T> {
    public ArrayExpr {
        elements = List.copyOf(elements);
    }
}
