package com.jsast.spanned;

import com.jsast.ast.SourceType;

import java.util.List;

/**
 * The root of a spanned tree.
 */
public record Program<T extends CharSequence>(SourceType sourceType, List<ProgramPart<T>> body) implements Node {
    public Program {
        body = List.copyOf(body);
    }

    public static <T extends CharSequence> Program<T> script(List<ProgramPart<T>> body) {
        return new Program<>(SourceType.SCRIPT, body);
    }

    public static <T extends CharSequence> Program<T> module(List<ProgramPart<T>> body) {
        return new Program<>(SourceType.MODULE, body);
    }
}
