package com.jsast.spanned;

public record NamedExport<T extends CharSequence>(Ident<T> local, Alias<T> alias) implements Node {
}
