package com.jsast.spanned;

public sealed interface ObjPatPart<T extends CharSequence> extends Node permits Prop, RestPat {
}
