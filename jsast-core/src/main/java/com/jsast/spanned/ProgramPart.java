package com.jsast.spanned;

/**
 * Anything allowed directly in a program or function body.
 */
public sealed interface ProgramPart<T extends CharSequence> extends Node permits Dir, Decl, Stmt {
}
