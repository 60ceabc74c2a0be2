package com.jsast.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeTextTest {

    private static final String SOURCE = "'use strict'; import d from 'm'; const [, x = 1e3] = f(`a${y}b`, /re/g);";

    private static SourceSlice slice(String text) {
        int from = SOURCE.indexOf(text);
        return SourceSlice.of(SOURCE, from, from + text.length());
    }

    private static Identifier<SourceSlice> id(String name) {
        return new Identifier<>(slice(name));
    }

    private static Program<SourceSlice> borrowed() {
        StringLiteral<SourceSlice> useStrict = new StringLiteral<>(QuoteKind.SINGLE, slice("use strict"));
        ImportDeclaration<SourceSlice> imp = new ImportDeclaration<>(
            List.<ImportClause<SourceSlice>>of(new ImportDefaultSpecifier<>(id("d"))), new StringLiteral<>(QuoteKind.SINGLE, slice("m")));
        TemplateLiteral<SourceSlice> template = new TemplateLiteral<>(
            List.of(new TemplateElement<>(slice("a"), false), new TemplateElement<>(slice("b"), true)),
            List.<Expression<SourceSlice>>of(id("y")));
        CallExpression<SourceSlice> call = new CallExpression<>(id("f"),
            List.<Expression<SourceSlice>>of(template, new RegExpLiteral<>(slice("re"), slice("g"))));
        ArrayPattern<SourceSlice> pattern = new ArrayPattern<>(Arrays.<ArrayPatternElement<SourceSlice>>asList(
            null, new AssignmentPattern<>(id("x"), new NumberLiteral<>(slice("1e3")))));
        VariableDeclaration<SourceSlice> decl = new VariableDeclaration<>(VariableKind.CONST,
            List.of(new VariableDeclarator<>(pattern, call)));
        return new Program<>(List.<ProgramPart<SourceSlice>>of(new Directive<>(useStrict, slice("use strict")), imp, decl), SourceType.MODULE);
    }

    private static Program<String> owned() {
        TemplateLiteral<String> template = new TemplateLiteral<>(
            List.of(new TemplateElement<>("a", false), new TemplateElement<>("b", true)),
            List.<Expression<String>>of(new Identifier<>("y")));
        CallExpression<String> call = new CallExpression<>(new Identifier<>("f"),
            List.<Expression<String>>of(template, new RegExpLiteral<>("re", "g")));
        ArrayPattern<String> pattern = new ArrayPattern<>(Arrays.<ArrayPatternElement<String>>asList(
            null, new AssignmentPattern<>(new Identifier<>("x"), new NumberLiteral<>("1e3"))));
        return new Program<>(List.<ProgramPart<String>>of(
            new Directive<>(new StringLiteral<>(QuoteKind.SINGLE, "use strict"), "use strict"),
            new ImportDeclaration<>(List.<ImportClause<String>>of(new ImportDefaultSpecifier<>(new Identifier<>("d"))),
                new StringLiteral<>(QuoteKind.SINGLE, "m")),
            new VariableDeclaration<>(VariableKind.CONST, List.of(new VariableDeclarator<>(pattern, call)))),
            SourceType.MODULE);
    }

    // function name(...rest) { throw thrown }
    private static Program<String> function(String name, String rest, String thrown) {
        List<FunctionParameter<String>> params = List.of(new RestElement<>(new Identifier<>(rest)));
        List<ProgramPart<String>> body = List.of(new ThrowStatement<>(new Identifier<>(thrown)));
        FunctionDeclaration<String> func = new FunctionDeclaration<>(
            new Identifier<>(name), params, new FunctionBody<>(body), false, false);
        return new Program<>(List.<ProgramPart<String>>of(func), SourceType.SCRIPT);
    }

    @Test
    @DisplayName("toOwned copies borrowed text into Strings and keeps the shape")
    void toOwnedCopiesEveryTextLeaf() {
        Program<String> copy = TreeText.toOwned(borrowed());

        assertEquals(owned(), copy);
        Directive<String> directive = (Directive<String>) copy.body().get(0);
        assertInstanceOf(String.class, directive.directive());
        assertInstanceOf(String.class, directive.expression().content());

        VariableDeclaration<String> decl = (VariableDeclaration<String>) copy.body().get(2);
        CallExpression<String> call = (CallExpression<String>) decl.declarations().get(0).init();
        assertInstanceOf(String.class, ((Identifier<String>) call.callee()).name());
        TemplateLiteral<String> template = (TemplateLiteral<String>) call.arguments().get(0);
        assertInstanceOf(String.class, template.quasis().get(1).raw());
        assertTrue(template.quasis().get(1).tail());
        RegExpLiteral<String> regex = (RegExpLiteral<String>) call.arguments().get(1);
        assertInstanceOf(String.class, regex.flags());
    }

    @Test
    void holesAndAbsentTextStayNull() {
        RegExpLiteral<SourceSlice> noFlags = new RegExpLiteral<>(slice("re"), null);
        Program<SourceSlice> program = new Program<>(List.<ProgramPart<SourceSlice>>of(
            new ExpressionStatement<>(new ArrayExpression<>(Arrays.<Expression<SourceSlice>>asList(null, noFlags))),
            new ReturnStatement<SourceSlice>(null)), SourceType.SCRIPT);

        Program<String> copy = TreeText.toOwned(program);

        ArrayExpression<String> array = (ArrayExpression<String>) ((ExpressionStatement<String>) copy.body().get(0)).expression();
        assertNull(array.elements().get(0));
        assertNull(((RegExpLiteral<String>) array.elements().get(1)).flags());
        assertEquals(new ReturnStatement<String>(null), copy.body().get(1));
    }

    @Test
    void mapTextAppliesTheFunctionToEveryLeaf() {
        Program<String> program = function("f", "args", "e");

        Program<String> upper = TreeText.mapText(program, name -> name.toUpperCase());

        assertEquals(function("F", "ARGS", "E"), upper);
    }

    @Test
    void copyIsUnmodifiable() {
        Program<String> copy = TreeText.toOwned(borrowed());
        assertThrows(UnsupportedOperationException.class, () -> copy.body().clear());
    }
}
