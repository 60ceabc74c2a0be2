package com.jsast.spanned;

/**
 * One element of a comma separated list, with the comma that followed it, if any.
 * A {@code null} item is an elided array element.
 */
public record ListEntry<I extends Node>(I item, Token comma) implements Node {

    public static <I extends Node> ListEntry<I> of(I item) {
        return new ListEntry<>(item, null);
    }

    public static <I extends Node> ListEntry<I> of(I item, Token comma) {
        return new ListEntry<>(item, comma);
    }

    public static <I extends Node> ListEntry<I> hole(Token comma) {
        return new ListEntry<>(null, comma);
    }

    public boolean isHole() {
        return item == null;
    }
}
