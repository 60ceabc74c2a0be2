package com.jsast.ast;

public sealed interface PropertyKey<T extends CharSequence> extends Node
    permits Expression, Pattern {
}
