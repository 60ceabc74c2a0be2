package com.jsast.spanned;

import java.util.List;

public record ClassBody<T extends CharSequence>(
    Token openBrace,
    List<Prop<T>> props,
    Token closeBrace
) implements Node {
    public ClassBody {
        props = List.copyOf(props);
    }
}
