package com.jsast.ast;

public sealed interface ImportClause<T extends CharSequence> extends Node
    permits ImportSpecifier, ImportDefaultSpecifier, ImportNamespaceSpecifier {
}
