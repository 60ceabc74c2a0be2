package com.jsast.spanned;

import java.util.List;

public record SwitchStmt<T extends CharSequence>(
    Token keyword,
    Token openParen,
    Expr<T> discriminant,
    Token closeParen,
    Token openBrace,
    List<SwitchCase<T>> cases,
    Token closeBrace
) implements Stmt<T> {
    public SwitchStmt {
        cases = List.copyOf(cases);
    }
}
