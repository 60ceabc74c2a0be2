package com.jsast.spanned;

import java.util.List;

public record BlockStmt<T extends CharSequence>(
    Token openBrace,
    List<ProgramPart<T>> stmts,
    Token closeBrace
) implements Stmt<T> {
    public BlockStmt {
        stmts = List.copyOf(stmts);
    }
}
