package com.jsast.spanned;

import com.jsast.spanned.SourceLocation.Position;

import java.util.Objects;

/**
 * A keyword or punctuator. Only the start is stored; the end follows from the kind's text.
 */
public record Token(TokenKind kind, Position start) implements Node {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(start, "start");
    }

    public static Token of(TokenKind kind, int line, int column) {
        return new Token(kind, new Position(line, column));
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public Position end() {
        return start.plusColumns(kind.length());
    }

    @Override
    public SourceLocation loc() {
        return new SourceLocation(start, end());
    }
}
