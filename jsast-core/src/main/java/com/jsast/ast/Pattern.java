package com.jsast.ast;

public sealed interface Pattern<T extends CharSequence> extends FunctionParameter<T>, ArrayPatternElement<T>, PropertyKey<T>, PropertyValue<T>, AssignmentTarget<T>, ForLeft<T>
    permits Identifier, ObjectPattern, ArrayPattern, AssignmentPattern {
}
