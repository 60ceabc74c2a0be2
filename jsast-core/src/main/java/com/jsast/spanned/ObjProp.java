package com.jsast.spanned;

public sealed interface ObjProp<T extends CharSequence> extends Node permits Prop, SpreadExpr {
}
