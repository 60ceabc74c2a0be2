package com.jsast.ast;

public sealed interface FunctionParameter<T extends CharSequence> extends Node
    permits Expression, Pattern, RestElement {
}
