package com.jsast.spanned;

public sealed interface LoopLeft<T extends CharSequence> extends Node permits Expr, Pat, LoopVar {
}
