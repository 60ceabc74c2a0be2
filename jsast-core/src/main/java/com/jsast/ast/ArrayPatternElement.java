package com.jsast.ast;

public sealed interface ArrayPatternElement<T extends CharSequence> extends Node
    permits Expression, Pattern, RestElement {
}
