package com.jsast.spanned;

public sealed interface AssignTarget<T extends CharSequence> extends Node permits Expr, Pat {
}
