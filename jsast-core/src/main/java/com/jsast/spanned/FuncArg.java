package com.jsast.spanned;

public sealed interface FuncArg<T extends CharSequence> extends Node permits Expr, Pat, RestPat {
}
