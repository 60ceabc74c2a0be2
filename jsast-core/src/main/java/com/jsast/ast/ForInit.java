package com.jsast.ast;

public sealed interface ForInit<T extends CharSequence> extends Node
    permits Expression, VariableDeclaration {
}
