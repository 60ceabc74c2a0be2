package com.jsast.spanned;

import java.util.List;

public record SequenceExpr<T extends CharSequence>(List<ListEntry<Expr<T>>> exprs) implements Expr<T> {
    public SequenceExpr {
        exprs = List.copyOf(exprs);
    }
}
