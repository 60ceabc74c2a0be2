package com.jsast.ast;

public sealed interface Declaration<T extends CharSequence> extends ProgramPart<T>, DefaultExportable<T>
    permits VariableDeclaration, FunctionDeclaration, ClassDeclaration, ImportDeclaration,
            ExportNamedDeclaration, ExportDefaultDeclaration, ExportAllDeclaration {
}
