package com.jsast.spanned;

import java.util.List;

/**
 * A parenthesized list the parser has not yet resolved into either a grouping or arrow
 * parameters. A finished tree never contains one.
 */
public record ArrowParamPlaceholder<T extends CharSequence>(
    Token asyncKeyword,
    Token openParen,
    List<ListEntry<FuncArg<T>>> args,
    Token closeParen
) implements Expr<T> {
    public ArrowParamPlaceholder {
        args = List.copyOf(args);
    }
}
