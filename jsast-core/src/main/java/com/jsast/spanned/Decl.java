package com.jsast.spanned;

public sealed interface Decl<T extends CharSequence> extends ProgramPart<T>
    permits Decl.Var, Decl.Import, Decl.Export, Func, ClassDef {

    /** {@code var a = 1, b;} in declaration position. */
    record Var<T extends CharSequence>(VarDecls<T> decls, Token semicolon) implements Decl<T> {
    }

    record Import<T extends CharSequence>(ModImport<T> specifier, Token semicolon) implements Decl<T> {
    }

    record Export<T extends CharSequence>(ModExport<T> specifier, Token semicolon) implements Decl<T> {
    }
}
