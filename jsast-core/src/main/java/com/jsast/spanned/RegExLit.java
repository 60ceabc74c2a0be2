package com.jsast.spanned;

/**
 * {@code /pattern/flags}; {@code flags} is null when there are none.
 */
public record RegExLit<T extends CharSequence>(
    Token openSlash,
    Slice<T> pattern,
    Token closeSlash,
    Slice<T> flags
) implements Lit<T> {
}
