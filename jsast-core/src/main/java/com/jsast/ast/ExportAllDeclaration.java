package com.jsast.ast;

public record ExportAllDeclaration<T extends CharSequence>(
    Identifier<T> exported,
    StringLiteral<T> source
) implements Declaration<T> {

    @Override
    public String type() {
        return "ExportAllDeclaration";
    }
}
