package com.jsast.spanned;

/**
 * An arrow body is either a block or a single expression.
 */
public sealed interface ArrowFuncBody<T extends CharSequence> extends Node permits FuncBody, Expr {
}
