package com.jsast.ast;

/**
 * A lexical unit whose source text is known ahead of time (keywords, punctuators, operators).
 */
public interface FixedText {

    /**
     * The exact source text of this unit.
     */
    String text();
}
