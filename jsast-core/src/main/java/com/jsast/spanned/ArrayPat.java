package com.jsast.spanned;

import java.util.List;

public record ArrayPat<T extends CharSequence>(
    Token openBracket,
    List<ListEntry<ArrayPatPart<T>>> elements,
    Token closeBracket
) implements Pat<T> {
    public ArrayPat {
        elements = List.copyOf(elements);
    }
}
