package com.jsast.spanned;

import java.util.List;

/**
 * {@code import a, {b as c} from 'd'}. A side-effect import has no specifiers and no {@code from}.
 */
public record ModImport<T extends CharSequence>(
    Token keyword,
    List<ListEntry<ImportSpec<T>>> specifiers,
    Token from,
    StringLit<T> source
) implements Node {
    public ModImport {
        specifiers = List.copyOf(specifiers);
    }
}
