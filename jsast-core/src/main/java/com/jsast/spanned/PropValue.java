package com.jsast.spanned;

public sealed interface PropValue<T extends CharSequence> extends Node permits Expr, Pat, PropMethod {
}
