package com.jsast.spanned;

public sealed interface PropKey<T extends CharSequence> extends Node permits Expr, Pat {
}
