package com.jsast.ast;

import java.util.List;

/**
 * A {@code var}, {@code let} or {@code const} declaration. The same node serves statement,
 * declaration and loop-head positions.
 */
public record VariableDeclaration<T extends CharSequence>(
    VariableKind kind,
    List<VariableDeclarator<T>> declarations
) implements Declaration<T>, Statement<T>, ForInit<T>, ForLeft<T> {

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
