package com.jsast.ast;

public sealed interface ForLeft<T extends CharSequence> extends Node
    permits Expression, Pattern, VariableDeclaration {
}
