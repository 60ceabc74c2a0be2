package com.jsast.spanned;

import java.util.List;

public record FuncBody<T extends CharSequence>(
    Token openBrace,
    List<ProgramPart<T>> stmts,
    Token closeBrace
) implements ArrowFuncBody<T> {
    public FuncBody {
        stmts = List.copyOf(stmts);
    }
}
