package com.jsast.ast;

public sealed interface ObjectMember<T extends CharSequence> extends Node
    permits Property, SpreadElement {
}
