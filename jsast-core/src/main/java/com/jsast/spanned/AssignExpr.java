package com.jsast.spanned;

import com.jsast.ast.AssignOperator;

public record AssignExpr<T extends CharSequence>(
    AssignTarget<T> left,
    OperatorToken<AssignOperator> operator,
    Expr<T> right
) implements Expr<T> {
}
