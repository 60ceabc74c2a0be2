package com.jsast.ast;

public sealed interface ArrowBody<T extends CharSequence> extends Node
    permits Expression, FunctionBody {
}
