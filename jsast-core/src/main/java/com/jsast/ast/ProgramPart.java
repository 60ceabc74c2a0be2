package com.jsast.ast;

/**
 * Anything allowed directly in a program or function body.
 */
public sealed interface ProgramPart<T extends CharSequence> extends Node
    permits Directive, Declaration, Statement {
}
