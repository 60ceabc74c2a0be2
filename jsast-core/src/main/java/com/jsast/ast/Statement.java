package com.jsast.ast;

public sealed interface Statement<T extends CharSequence> extends ProgramPart<T>
    permits ExpressionStatement, BlockStatement, EmptyStatement, DebuggerStatement, WithStatement,
            ReturnStatement, LabeledStatement, BreakStatement, ContinueStatement, IfStatement, SwitchStatement,
            ThrowStatement, TryStatement, WhileStatement, DoWhileStatement, ForStatement, ForInStatement,
            ForOfStatement, VariableDeclaration {
}
