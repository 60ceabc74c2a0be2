package com.jsast.spanned;

public sealed interface ArrayPatPart<T extends CharSequence> extends Node permits Pat, Expr, RestPat {
}
