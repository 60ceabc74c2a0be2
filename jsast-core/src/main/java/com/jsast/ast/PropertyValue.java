package com.jsast.ast;

public sealed interface PropertyValue<T extends CharSequence> extends Node
    permits Expression, Pattern {
}
