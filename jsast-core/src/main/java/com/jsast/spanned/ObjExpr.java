package com.jsast.spanned;

import java.util.List;

public record ObjExpr<T extends CharSequence>(
    Token openBrace,
    List<ListEntry<ObjProp<T>>> props,
    Token closeBrace
) implements Expr<T> {
    public ObjExpr {
        props = List.copyOf(props);
    }
}
