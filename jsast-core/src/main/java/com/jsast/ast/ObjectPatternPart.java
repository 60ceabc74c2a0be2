package com.jsast.ast;

public sealed interface ObjectPatternPart<T extends CharSequence> extends Node
    permits Property, RestElement {
}
