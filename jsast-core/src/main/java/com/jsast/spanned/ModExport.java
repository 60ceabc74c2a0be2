package com.jsast.spanned;

public record ModExport<T extends CharSequence>(Token keyword, ModExportSpec<T> spec) implements Node {
}
