package com.jsast.ast;

public sealed interface AssignmentTarget<T extends CharSequence> extends Node
    permits Expression, Pattern {
}
