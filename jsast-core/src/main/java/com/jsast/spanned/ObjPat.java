package com.jsast.spanned;

import java.util.List;

public record ObjPat<T extends CharSequence>(
    Token openBrace,
    List<ListEntry<ObjPatPart<T>>> props,
    Token closeBrace
) implements Pat<T> {
    public ObjPat {
        props = List.copyOf(props);
    }
}
