package com.jsast.spanned;

public sealed interface LoopInit<T extends CharSequence> extends Node permits Expr, VarDecls {
}
