package com.jsast.spanned;

import com.jsast.ast.VariableKind;

import java.util.List;

/**
 * A declaration keyword with its declarators, shared by statements and for-loop heads.
 */
public record VarDecls<T extends CharSequence>(
    OperatorToken<VariableKind> keyword,
    List<ListEntry<VarDecl<T>>> decls
) implements LoopInit<T> {
    public VarDecls {
        decls = List.copyOf(decls);
    }
}
