package com.jsast.spanned;

import com.jsast.ast.VariableKind;

/**
 * The declaration on the left of a for-in or for-of loop.
 */
public record LoopVar<T extends CharSequence>(OperatorToken<VariableKind> keyword, VarDecl<T> decl) implements LoopLeft<T> {
}
