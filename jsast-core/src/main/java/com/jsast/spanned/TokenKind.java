package com.jsast.spanned;

import com.jsast.ast.FixedText;

/**
 * Keywords and punctuators that appear inside composite nodes. Operators live in their own
 * enums in {@code com.jsast.ast}.
 */
public enum TokenKind implements FixedText {
    // keywords
    AS("as"),
    ASYNC("async"),
    AWAIT("await"),
    BREAK("break"),
    CASE("case"),
    CATCH("catch"),
    CLASS("class"),
    CONST("const"),
    CONTINUE("continue"),
    DEBUGGER("debugger"),
    DEFAULT("default"),
    DO("do"),
    ELSE("else"),
    EXPORT("export"),
    EXTENDS("extends"),
    FALSE("false"),
    FINALLY("finally"),
    FOR("for"),
    FROM("from"),
    FUNCTION("function"),
    GET("get"),
    IF("if"),
    IMPORT("import"),
    IN("in"),
    LET("let"),
    NEW("new"),
    NULL("null"),
    OF("of"),
    RETURN("return"),
    SET("set"),
    STATIC("static"),
    SUPER("super"),
    SWITCH("switch"),
    THIS("this"),
    THROW("throw"),
    TRUE("true"),
    TRY("try"),
    VAR("var"),
    WHILE("while"),
    WITH("with"),
    YIELD("yield"),

    // punctuation
    ASTERISK("*"),
    BACK_TICK("`"),
    CLOSE_BRACE("}"),
    CLOSE_BRACKET("]"),
    CLOSE_PAREN(")"),
    COLON(":"),
    COMMA(","),
    DOLLAR_SIGN_OPEN_BRACE("${"),
    DOUBLE_QUOTE("\""),
    ELLIPSIS("..."),
    EQUAL("="),
    FAT_ARROW("=>"),
    FORWARD_SLASH("/"),
    OPEN_BRACE("{"),
    OPEN_BRACKET("["),
    OPEN_PAREN("("),
    PERIOD("."),
    QUESTION_MARK("?"),
    SEMICOLON(";"),
    SINGLE_QUOTE("'");

    private final String text;

    TokenKind(String text) {
        this.text = text;
    }

    @Override
    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }
}
