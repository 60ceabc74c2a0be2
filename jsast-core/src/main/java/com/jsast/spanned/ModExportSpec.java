package com.jsast.spanned;

import java.util.List;

/**
 * Everything that can follow the {@code export} keyword.
 */
public sealed interface ModExportSpec<T extends CharSequence> extends Node
    permits ModExportSpec.DefaultDecl, ModExportSpec.DefaultExpr, ModExportSpec.NamedDecl,
            ModExportSpec.NamedList, ModExportSpec.All {

    record DefaultDecl<T extends CharSequence>(Token keyword, Decl<T> decl) implements ModExportSpec<T> {
    }

    record DefaultExpr<T extends CharSequence>(Token keyword, Expr<T> expr) implements ModExportSpec<T> {
    }

    record NamedDecl<T extends CharSequence>(Decl<T> decl) implements ModExportSpec<T> {
    }

    /** {@code {a, b as c} from 'd'}; {@code from} and {@code source} are absent for local re-exports. */
    record NamedList<T extends CharSequence>(
        Token openBrace,
        List<ListEntry<NamedExport<T>>> specs,
        Token closeBrace,
        Token from,
        StringLit<T> source
    ) implements ModExportSpec<T> {
        public NamedList {
            specs = List.copyOf(specs);
        }
    }

    /** {@code * as name from 'd'} */
    record All<T extends CharSequence>(Token star, Alias<T> alias, Token from, StringLit<T> source)
        implements ModExportSpec<T> {
    }
}
