package com.jsast.spanned;

import com.jsast.ast.BinaryOperator;
import com.jsast.ast.QuoteKind;
import com.jsast.ast.UnaryOperator;
import com.jsast.ast.UpdateOperator;
import com.jsast.ast.VariableKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Location rules, one production family at a time. Sources are single-line unless noted,
 * with columns counted from zero.
 */
public class LocationRulesTest {

    private static Token tok(TokenKind kind, int column) {
        return Token.of(kind, 1, column);
    }

    private static Ident<String> id(String name, int column) {
        return Ident.of(name, 1, column);
    }

    private static Lit.Num<String> num(String raw, int column) {
        return Lit.Num.of(raw, 1, column);
    }

    private static SourceLocation cols(int from, int to) {
        return new SourceLocation(1, from, 1, to);
    }

    @Nested
    class Expressions {

        @Test
        @DisplayName("1+2 spans its operands")
        void binary() {
            BinaryExpr<String> expr = new BinaryExpr<>(num("1", 0), OperatorToken.of(BinaryOperator.PLUS, 1, 1), num("2", 2));
            assertEquals(cols(0, 3), expr.loc());
            assertTrue(expr.loc().contains(expr.left().loc()));
            assertTrue(expr.loc().contains(expr.right().loc()));
        }

        @Test
        void prefixAndPostfixUpdate() {
            // ++x
            UpdateExpr<String> prefix = new UpdateExpr<>(OperatorToken.of(UpdateOperator.INCREMENT, 1, 0), id("x", 2));
            // x++
            UpdateExpr<String> postfix = new UpdateExpr<>(OperatorToken.of(UpdateOperator.INCREMENT, 1, 1), id("x", 0));
            assertEquals(cols(0, 3), prefix.loc());
            assertEquals(cols(0, 3), postfix.loc());
            assertTrue(prefix.isPrefix());
            assertFalse(postfix.isPrefix());
        }

        @Test
        void typeofSpansKeywordAndArgument() {
            UnaryExpr<String> expr = new UnaryExpr<>(OperatorToken.of(UnaryOperator.TYPE_OF, 1, 0), id("x", 7));
            assertEquals(cols(0, 8), expr.loc());
        }

        @Test
        void emptyArrayIsItsBrackets() {
            ArrayExpr<String> array = new ArrayExpr<>(tok(TokenKind.OPEN_BRACKET, 0), List.of(), tok(TokenKind.CLOSE_BRACKET, 1));
            assertEquals(cols(0, 2), array.loc());
        }

        @Test
        void arrayHoleIsItsComma() {
            ListEntry<Expr<String>> hole = ListEntry.hole(tok(TokenKind.COMMA, 1));
            assertTrue(hole.isHole());
            assertEquals(cols(1, 2), hole.loc());
        }

        @Test
        void listEntryIncludesItsComma() {
            ListEntry<Expr<String>> entry = ListEntry.of(id("abc", 0), tok(TokenKind.COMMA, 3));
            assertEquals(cols(0, 4), entry.loc());
            assertEquals(cols(0, 3), ListEntry.<Expr<String>>of(id("abc", 0)).loc());
        }

        @Test
        void callEndsAtClosingParen() {
            // f(a, b)
            List<ListEntry<Expr<String>>> args = List.of(
                ListEntry.of(id("a", 2), tok(TokenKind.COMMA, 3)),
                ListEntry.of(id("b", 5)));
            CallExpr<String> call = new CallExpr<>(id("f", 0), tok(TokenKind.OPEN_PAREN, 1), args, tok(TokenKind.CLOSE_PAREN, 6));
            assertEquals(cols(0, 7), call.loc());
        }

        @Test
        @DisplayName("new without arguments starts at its keyword and ends at the callee")
        void newWithoutArguments() {
            NewExpr<String> expr = new NewExpr<>(tok(TokenKind.NEW, 0), id("Foo", 4), null, null, null);
            assertEquals(cols(0, 7), expr.loc());
        }

        @Test
        void newWithArguments() {
            // new Foo()
            NewExpr<String> expr = new NewExpr<>(tok(TokenKind.NEW, 0), id("Foo", 4),
                tok(TokenKind.OPEN_PAREN, 7), List.of(), tok(TokenKind.CLOSE_PAREN, 8));
            assertEquals(cols(0, 9), expr.loc());
        }

        @Test
        void dottedAndComputedMembers() {
            // a.b
            MemberExpr<String> dotted = MemberExpr.dotted(id("a", 0), tok(TokenKind.PERIOD, 1), id("b", 2));
            // a[0]
            MemberExpr<String> computed = MemberExpr.computed(
                id("a", 0), tok(TokenKind.OPEN_BRACKET, 1), num("0", 2), tok(TokenKind.CLOSE_BRACKET, 3));
            assertEquals(cols(0, 3), dotted.loc());
            assertEquals(cols(0, 4), computed.loc());
            assertFalse(dotted.isComputed());
            assertTrue(computed.isComputed());
        }

        @Test
        void wrappedIncludesParens() {
            WrappedExpr<String> wrapped = new WrappedExpr<>(tok(TokenKind.OPEN_PAREN, 0), id("a", 1), tok(TokenKind.CLOSE_PAREN, 2));
            assertEquals(cols(0, 3), wrapped.loc());
        }

        @Test
        void conditionalSpansTestToAlternate() {
            // a ? b : c
            ConditionalExpr<String> expr = new ConditionalExpr<>(
                id("a", 0), tok(TokenKind.QUESTION_MARK, 2), id("b", 4), tok(TokenKind.COLON, 6), id("c", 8));
            assertEquals(cols(0, 9), expr.loc());
        }

        @Test
        void yieldWithoutArgument() {
            assertEquals(cols(0, 5), new YieldExpr<String>(tok(TokenKind.YIELD, 0), null, null).loc());
            assertEquals(cols(0, 6), new YieldExpr<String>(tok(TokenKind.YIELD, 0), tok(TokenKind.ASTERISK, 5), null).loc());
        }

        @Test
        void arrowWithoutParens() {
            // x => x
            List<ListEntry<FuncArg<String>>> params = List.of(ListEntry.<FuncArg<String>>of(id("x", 0)));
            ArrowFuncExpr<String> arrow = new ArrowFuncExpr<>(null, null, params, null, tok(TokenKind.FAT_ARROW, 2), id("x", 5));
            assertEquals(cols(0, 6), arrow.loc());
        }

        @Test
        void stringIncludesQuotes() {
            StringLit<String> lit = StringLit.of(QuoteKind.SINGLE, "abc", 1, 4);
            assertEquals(cols(4, 9), lit.loc());
        }

        @Test
        @DisplayName("a template spans its first and last quasis, backtick to backtick")
        void templateSpansItsQuasis() {
            // `a${b}c`
            TemplateElement<String> head = new TemplateElement<>(tok(TokenKind.BACK_TICK, 0), Slice.of("a", 1, 1),
                tok(TokenKind.DOLLAR_SIGN_OPEN_BRACE, 2));
            TemplateElement<String> tail = new TemplateElement<>(tok(TokenKind.CLOSE_BRACE, 5), Slice.of("c", 1, 6),
                tok(TokenKind.BACK_TICK, 7));
            TemplateLit<String> template = new TemplateLit<>(List.of(head, tail), List.<Expr<String>>of(id("b", 4)));

            assertEquals(cols(0, 4), head.loc());
            assertEquals(cols(5, 8), tail.loc());
            assertFalse(head.isTail());
            assertTrue(tail.isTail());
            assertEquals(cols(0, 8), template.loc());
        }

        @Test
        void regexIncludesFlags() {
            // /a+/gi
            RegExLit<String> withFlags = new RegExLit<>(tok(TokenKind.FORWARD_SLASH, 0), Slice.of("a+", 1, 1),
                tok(TokenKind.FORWARD_SLASH, 3), Slice.of("gi", 1, 4));
            RegExLit<String> bare = new RegExLit<>(tok(TokenKind.FORWARD_SLASH, 0), Slice.of("a+", 1, 1),
                tok(TokenKind.FORWARD_SLASH, 3), null);
            assertEquals(cols(0, 6), withFlags.loc());
            assertEquals(cols(0, 4), bare.loc());
        }
    }

    @Nested
    class Statements {

        @Test
        void semicolonExtendsExpressionStatement() {
            Stmt.ExprStmt<String> withSemi = new Stmt.ExprStmt<>(id("a", 0), tok(TokenKind.SEMICOLON, 1));
            Stmt.ExprStmt<String> withoutSemi = new Stmt.ExprStmt<>(id("a", 0), null);
            assertEquals(cols(0, 2), withSemi.loc());
            assertEquals(cols(0, 1), withoutSemi.loc());
        }

        @Test
        void bareReturnAndContinue() {
            assertEquals(cols(0, 6), new Stmt.Return<String>(tok(TokenKind.RETURN, 0), null, null).loc());
            assertEquals(cols(0, 9), new Stmt.Continue<String>(tok(TokenKind.CONTINUE, 0), null, tok(TokenKind.SEMICOLON, 8)).loc());
            assertEquals(cols(0, 11), new Stmt.Break<String>(tok(TokenKind.BREAK, 0), id("outer", 6), null).loc());
        }

        @Test
        void throwEndsAtSemicolonWhenPresent() {
            // throw x
            Stmt.Throw<String> bare = new Stmt.Throw<>(tok(TokenKind.THROW, 0), id("x", 6), null);
            // throw x;
            Stmt.Throw<String> terminated = new Stmt.Throw<>(tok(TokenKind.THROW, 0), id("x", 6), tok(TokenKind.SEMICOLON, 7));
            assertEquals(cols(0, 7), bare.loc());
            assertEquals(cols(0, 8), terminated.loc());
        }

        @Test
        void directiveEndsAtQuoteOrSemicolon() {
            // "use strict"
            Dir<String> bare = new Dir<>(StringLit.of(QuoteKind.DOUBLE, "use strict", 1, 0), null);
            // "use strict";
            Dir<String> terminated = new Dir<>(StringLit.of(QuoteKind.DOUBLE, "use strict", 1, 0),
                tok(TokenKind.SEMICOLON, 12));
            assertEquals(cols(0, 12), bare.loc());
            assertEquals(cols(0, 13), terminated.loc());
        }

        @Test
        @DisplayName("do-while without a semicolon ends one column past its closing paren")
        void doWhileWithoutSemicolon() {
            // do ; while (x)
            DoWhileStmt<String> stmt = new DoWhileStmt<>(tok(TokenKind.DO, 0), new Stmt.Empty<>(tok(TokenKind.SEMICOLON, 3)),
                tok(TokenKind.WHILE, 5), tok(TokenKind.OPEN_PAREN, 11), id("x", 12), tok(TokenKind.CLOSE_PAREN, 13), null);
            assertEquals(cols(0, 15), stmt.loc());
        }

        @Test
        void doWhileWithSemicolon() {
            // do ; while (x) ;
            DoWhileStmt<String> stmt = new DoWhileStmt<>(tok(TokenKind.DO, 0), new Stmt.Empty<>(tok(TokenKind.SEMICOLON, 3)),
                tok(TokenKind.WHILE, 5), tok(TokenKind.OPEN_PAREN, 11), id("x", 12), tok(TokenKind.CLOSE_PAREN, 13),
                tok(TokenKind.SEMICOLON, 15));
            assertEquals(cols(0, 16), stmt.loc());
        }

        @Test
        void switchEndsAtClosingBrace() {
            // switch (x) {}
            SwitchStmt<String> stmt = new SwitchStmt<>(tok(TokenKind.SWITCH, 0), tok(TokenKind.OPEN_PAREN, 7), id("x", 8),
                tok(TokenKind.CLOSE_PAREN, 9), tok(TokenKind.OPEN_BRACE, 11), List.of(), tok(TokenKind.CLOSE_BRACE, 12));
            assertEquals(cols(0, 13), stmt.loc());
        }

        @Test
        void emptyCaseEndsAtColon() {
            // case 1:
            SwitchCase<String> c = new SwitchCase<>(tok(TokenKind.CASE, 0), num("1", 5), tok(TokenKind.COLON, 6), List.of());
            assertEquals(cols(0, 7), c.loc());
        }

        @Test
        void ifSpansLinesToItsElse() {
            // if (a) b;
            // else c;
            IfStmt<String> stmt = new IfStmt<>(tok(TokenKind.IF, 0), tok(TokenKind.OPEN_PAREN, 3), id("a", 4),
                tok(TokenKind.CLOSE_PAREN, 5), new Stmt.ExprStmt<>(id("b", 7), tok(TokenKind.SEMICOLON, 8)),
                new ElseClause<>(Token.of(TokenKind.ELSE, 2, 0),
                    new Stmt.ExprStmt<>(Ident.of("c", 2, 5), Token.of(TokenKind.SEMICOLON, 2, 6))));
            assertEquals(new SourceLocation(1, 0, 2, 7), stmt.loc());
        }

        @Test
        void varDeclarationWithoutInitializer() {
            // let a, b = 1;
            VarDecls<String> decls = new VarDecls<String>(OperatorToken.of(VariableKind.LET, 1, 0), List.of(
                ListEntry.of(new VarDecl<>(id("a", 4)), tok(TokenKind.COMMA, 5)),
                ListEntry.of(new VarDecl<String>(id("b", 7), tok(TokenKind.EQUAL, 9), num("1", 11)))));
            Stmt.Var<String> stmt = new Stmt.Var<>(decls, tok(TokenKind.SEMICOLON, 12));
            assertEquals(cols(4, 5), new VarDecl<>(id("a", 4)).loc());
            assertEquals(cols(0, 12), decls.loc());
            assertEquals(cols(0, 13), stmt.loc());
        }

        @Test
        void tryWithoutFinallyEndsAtHandler() {
            // try {} catch {}
            TryStmt<String> stmt = new TryStmt<String>(tok(TokenKind.TRY, 0),
                new BlockStmt<>(tok(TokenKind.OPEN_BRACE, 4), List.of(), tok(TokenKind.CLOSE_BRACE, 5)),
                new CatchClause<>(tok(TokenKind.CATCH, 7), null,
                    new BlockStmt<>(tok(TokenKind.OPEN_BRACE, 13), List.of(), tok(TokenKind.CLOSE_BRACE, 14))),
                null);
            assertEquals(cols(0, 15), stmt.loc());
        }
    }

    @Nested
    class Collections {

        @Test
        void emptyProgramIsZero() {
            assertTrue(Program.<String>script(List.of()).loc().isZero());
        }

        @Test
        void emptyListIsZero() {
            assertEquals(SourceLocation.zero(), LocationRules.ofList(List.of()));
        }

        @Test
        void programSpansFirstToLastPart() {
            Program<String> program = Program.<String>script(List.of(
                new Stmt.ExprStmt<>(id("a", 0), tok(TokenKind.SEMICOLON, 1)),
                new Stmt.ExprStmt<>(Ident.of("b", 3, 2), null)));
            assertEquals(new SourceLocation(1, 0, 3, 3), program.loc());
        }

        @Test
        @DisplayName("a node copies its list, so later edits to the caller's list do not move it")
        void nodesCopyTheirLists() {
            List<ProgramPart<String>> parts = new ArrayList<>();
            parts.add(new Stmt.ExprStmt<>(id("a", 0), tok(TokenKind.SEMICOLON, 1)));
            Program<String> program = Program.script(parts);
            FuncBody<String> body = new FuncBody<>(tok(TokenKind.OPEN_BRACE, 0), parts, tok(TokenKind.CLOSE_BRACE, 9));

            parts.add(new Stmt.ExprStmt<>(id("b", 5), null));

            assertEquals(cols(0, 2), program.loc());
            assertEquals(1, program.body().size());
            assertEquals(1, body.stmts().size());
            assertThrows(UnsupportedOperationException.class, () -> program.body().clear());
        }

        @Test
        void emptyFunctionBodyIsItsBraces() {
            FuncBody<String> body = new FuncBody<>(tok(TokenKind.OPEN_BRACE, 14), List.of(), tok(TokenKind.CLOSE_BRACE, 15));
            assertEquals(cols(14, 16), body.loc());
        }
    }

    @Test
    void functionStartsAtAsync() {
        // async function f() {}
        Func<String> func = new Func<>(tok(TokenKind.ASYNC, 0), tok(TokenKind.FUNCTION, 6), null, id("f", 15),
            tok(TokenKind.OPEN_PAREN, 16), List.of(), tok(TokenKind.CLOSE_PAREN, 17),
            new FuncBody<>(tok(TokenKind.OPEN_BRACE, 19), List.of(), tok(TokenKind.CLOSE_BRACE, 20)));
        assertEquals(cols(0, 21), func.loc());
        assertTrue(func.isAsync());
        assertFalse(func.isGenerator());
    }

    @Test
    void unknownNodeTypeIsRejected() {
        Node stranger = new Node() {
        };
        assertThrows(IllegalArgumentException.class, () -> LocationRules.of(stranger));
    }
}
