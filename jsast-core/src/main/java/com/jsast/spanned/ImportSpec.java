package com.jsast.spanned;

import java.util.List;

public sealed interface ImportSpec<T extends CharSequence> extends Node
    permits ImportSpec.Normal, ImportSpec.Default, ImportSpec.Namespace {

    /** {@code {a, b as c}} */
    record Normal<T extends CharSequence>(
        Token openBrace,
        List<ListEntry<NormalImportSpec<T>>> specs,
        Token closeBrace
    ) implements ImportSpec<T> {
        public Normal {
            specs = List.copyOf(specs);
        }
    }

    record Default<T extends CharSequence>(Ident<T> local) implements ImportSpec<T> {
    }

    /** {@code * as ns} */
    record Namespace<T extends CharSequence>(Token star, Token as, Ident<T> local) implements ImportSpec<T> {
    }
}
