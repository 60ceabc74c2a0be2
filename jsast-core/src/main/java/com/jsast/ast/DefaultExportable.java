package com.jsast.ast;

/**
 * What may follow {@code export default}.
 */
public sealed interface DefaultExportable<T extends CharSequence> extends Node
    permits Declaration, Expression {
}
