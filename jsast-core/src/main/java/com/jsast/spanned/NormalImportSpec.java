package com.jsast.spanned;

public record NormalImportSpec<T extends CharSequence>(Ident<T> imported, Alias<T> alias) implements Node {
}
