package com.jsast.spanned;

/**
 * Statements. Terminating semicolons are null when automatic semicolon insertion supplied them.
 */
public sealed interface Stmt<T extends CharSequence> extends ProgramPart<T>
    permits Stmt.ExprStmt, Stmt.Empty, Stmt.Debugger, Stmt.Return, Stmt.Break, Stmt.Continue,
            Stmt.Throw, Stmt.Var, BlockStmt, WithStmt, LabeledStmt, IfStmt, SwitchStmt, TryStmt,
            WhileStmt, DoWhileStmt, ForStmt, ForInStmt, ForOfStmt {

    record ExprStmt<T extends CharSequence>(Expr<T> expr, Token semicolon) implements Stmt<T> {
    }

    record Empty<T extends CharSequence>(Token semicolon) implements Stmt<T> {
    }

    record Debugger<T extends CharSequence>(Token keyword, Token semicolon) implements Stmt<T> {
    }

    record Return<T extends CharSequence>(Token keyword, Expr<T> value, Token semicolon) implements Stmt<T> {
    }

    record Break<T extends CharSequence>(Token keyword, Ident<T> label, Token semicolon) implements Stmt<T> {
    }

    record Continue<T extends CharSequence>(Token keyword, Ident<T> label, Token semicolon) implements Stmt<T> {
    }

    record Throw<T extends CharSequence>(Token keyword, Expr<T> expr, Token semicolon) implements Stmt<T> {
    }

    record Var<T extends CharSequence>(VarDecls<T> decls, Token semicolon) implements Stmt<T> {
    }
}
