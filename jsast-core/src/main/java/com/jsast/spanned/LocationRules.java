package com.jsast.spanned;

import com.jsast.spanned.SourceLocation.Position;

import java.util.List;

/**
 * The location rule of every spanned production.
 *
 * <p>Each rule looks only at a node's direct children: a composite node spans from the
 * start of its first present constituent to the end of its last one. Optional trailing
 * semicolons extend a statement when present. An elided do-while semicolon is the one
 * exception: the statement then ends one column past its closing parenthesis.</p>
 */
public final class LocationRules {

    private LocationRules() {
    }

    /**
     * The location of any spanned node.
     *
     * @throws IllegalArgumentException for a node type with no rule
     */
    public static SourceLocation of(Node node) {
        // leaves
        if (node instanceof Token t) {
            return new SourceLocation(t.start(), t.end());
        }
        if (node instanceof OperatorToken<?> t) {
            return new SourceLocation(t.start(), t.end());
        }
        if (node instanceof Slice<?> s) {
            return s.loc();
        }
        if (node instanceof ListEntry<?> e) {
            return entry(e);
        }
        if (node instanceof Ident<?> id) {
            return id.slice().loc();
        }

        // program level
        if (node instanceof Program<?> p) {
            return ofList(p.body());
        }
        if (node instanceof Dir<?> d) {
            return between(d.expr(), d.semicolon(), d.expr());
        }

        // declarations
        if (node instanceof Decl.Var<?> v) {
            return between(v.decls(), v.semicolon(), v.decls());
        }
        if (node instanceof Decl.Import<?> i) {
            return between(i.specifier(), i.semicolon(), i.specifier());
        }
        if (node instanceof Decl.Export<?> e) {
            return between(e.specifier(), e.semicolon(), e.specifier());
        }
        if (node instanceof VarDecls<?> v) {
            return between(v.keyword(), last(v.decls()), v.keyword());
        }
        if (node instanceof VarDecl<?> v) {
            return between(v.id(), v.init(), v.eq(), v.id());
        }
        if (node instanceof LoopVar<?> v) {
            return span(v.keyword(), v.decl());
        }
        if (node instanceof ModImport<?> m) {
            return span(m.keyword(), m.source());
        }
        if (node instanceof ImportSpec.Normal<?> n) {
            return span(n.openBrace(), n.closeBrace());
        }
        if (node instanceof ImportSpec.Default<?> d) {
            return d.local().loc();
        }
        if (node instanceof ImportSpec.Namespace<?> n) {
            return span(n.star(), n.local());
        }
        if (node instanceof NormalImportSpec<?> n) {
            return between(n.imported(), n.alias(), n.imported());
        }
        if (node instanceof Alias<?> a) {
            return span(a.as(), a.ident());
        }
        if (node instanceof ModExport<?> m) {
            return span(m.keyword(), m.spec());
        }
        if (node instanceof ModExportSpec.DefaultDecl<?> d) {
            return span(d.keyword(), d.decl());
        }
        if (node instanceof ModExportSpec.DefaultExpr<?> d) {
            return span(d.keyword(), d.expr());
        }
        if (node instanceof ModExportSpec.NamedDecl<?> d) {
            return d.decl().loc();
        }
        if (node instanceof ModExportSpec.NamedList<?> n) {
            return between(n.openBrace(), n.source(), n.closeBrace());
        }
        if (node instanceof ModExportSpec.All<?> a) {
            return span(a.star(), a.source());
        }
        if (node instanceof NamedExport<?> n) {
            return between(n.local(), n.alias(), n.local());
        }

        // functions and classes
        if (node instanceof Func<?> f) {
            return span(firstOf(f.asyncKeyword(), f.keyword()), f.body());
        }
        if (node instanceof FuncBody<?> b) {
            return span(b.openBrace(), b.closeBrace());
        }
        if (node instanceof ClassDef<?> c) {
            return span(c.keyword(), c.body());
        }
        if (node instanceof SuperClass<?> s) {
            return span(s.extendsKeyword(), s.expr());
        }
        if (node instanceof ClassBody<?> b) {
            return span(b.openBrace(), b.closeBrace());
        }
        if (node instanceof PropInitKey<?> k) {
            return span(firstOf(k.openBracket(), k.value()), firstOf(k.closeBracket(), k.value()));
        }
        if (node instanceof PropInit<?> p) {
            return between(p.key(), p.value(), p.colon(), p.key());
        }
        if (node instanceof PropMethod<?> m) {
            return span(firstOf(m.staticKeyword(), m.asyncKeyword(), m.star(), m.id()), m.body());
        }
        if (node instanceof PropCtor<?> c) {
            return span(c.keyword(), c.body());
        }
        if (node instanceof PropGet<?> g) {
            return span(firstOf(g.staticKeyword(), g.getKeyword()), g.body());
        }
        if (node instanceof PropSet<?> s) {
            return span(firstOf(s.staticKeyword(), s.setKeyword()), s.body());
        }

        // expressions
        if (node instanceof Expr.This<?> t) {
            return t.keyword().loc();
        }
        if (node instanceof Expr.Super<?> s) {
            return s.keyword().loc();
        }
        if (node instanceof ArrayExpr<?> a) {
            return span(a.openBracket(), a.closeBracket());
        }
        if (node instanceof ObjExpr<?> o) {
            return span(o.openBrace(), o.closeBrace());
        }
        if (node instanceof ArrowFuncExpr<?> a) {
            return span(firstOf(a.asyncKeyword(), a.openParen(), first(a.params()), a.arrow()), a.body());
        }
        if (node instanceof ArrowParamPlaceholder<?> a) {
            return span(firstOf(a.asyncKeyword(), a.openParen()), a.closeParen());
        }
        if (node instanceof AssignExpr<?> a) {
            return span(a.left(), a.right());
        }
        if (node instanceof AwaitExpr<?> a) {
            return span(a.keyword(), a.expr());
        }
        if (node instanceof BinaryExpr<?> b) {
            return span(b.left(), b.right());
        }
        if (node instanceof LogicalExpr<?> l) {
            return span(l.left(), l.right());
        }
        if (node instanceof UnaryExpr<?> u) {
            return operatorAndArgument(u.operator(), u.argument());
        }
        if (node instanceof UpdateExpr<?> u) {
            return operatorAndArgument(u.operator(), u.argument());
        }
        if (node instanceof MemberExpr<?> m) {
            return span(m.object(), firstOf(m.closeBracket(), m.property()));
        }
        if (node instanceof ConditionalExpr<?> c) {
            return span(c.test(), c.alternate());
        }
        if (node instanceof CallExpr<?> c) {
            return span(c.callee(), c.closeParen());
        }
        if (node instanceof NewExpr<?> n) {
            return span(n.keyword(), firstOf(n.closeParen(), n.callee()));
        }
        if (node instanceof SequenceExpr<?> s) {
            return ofList(s.exprs());
        }
        if (node instanceof SpreadExpr<?> s) {
            return span(s.ellipsis(), s.expr());
        }
        if (node instanceof YieldExpr<?> y) {
            return between(y.keyword(), y.argument(), y.star(), y.keyword());
        }
        if (node instanceof MetaProp<?> m) {
            return span(m.meta(), m.property());
        }
        if (node instanceof TaggedTemplateExpr<?> t) {
            return span(t.tag(), t.quasi());
        }
        if (node instanceof WrappedExpr<?> w) {
            return span(w.openParen(), w.closeParen());
        }

        // literals
        if (node instanceof Lit.Null<?> n) {
            return n.keyword().loc();
        }
        if (node instanceof Lit.Bool<?> b) {
            return b.keyword().loc();
        }
        if (node instanceof Lit.Num<?> n) {
            return n.raw().loc();
        }
        if (node instanceof StringLit<?> s) {
            return span(s.openQuote(), s.closeQuote());
        }
        if (node instanceof RegExLit<?> r) {
            return between(r.openSlash(), r.flags(), r.closeSlash());
        }
        if (node instanceof TemplateLit<?> t) {
            return ofList(t.quasis());
        }
        if (node instanceof TemplateElement<?> e) {
            return span(e.openQuote(), e.closeQuote());
        }

        // patterns
        if (node instanceof ObjPat<?> o) {
            return span(o.openBrace(), o.closeBrace());
        }
        if (node instanceof ArrayPat<?> a) {
            return span(a.openBracket(), a.closeBracket());
        }
        if (node instanceof AssignPat<?> a) {
            return span(a.left(), a.right());
        }
        if (node instanceof RestPat<?> r) {
            return span(r.ellipsis(), r.pat());
        }

        // statements
        if (node instanceof Stmt.ExprStmt<?> s) {
            return between(s.expr(), s.semicolon(), s.expr());
        }
        if (node instanceof Stmt.Empty<?> s) {
            return s.semicolon().loc();
        }
        if (node instanceof Stmt.Debugger<?> s) {
            return between(s.keyword(), s.semicolon(), s.keyword());
        }
        if (node instanceof Stmt.Return<?> s) {
            return between(s.keyword(), s.semicolon(), s.value(), s.keyword());
        }
        if (node instanceof Stmt.Break<?> s) {
            return between(s.keyword(), s.semicolon(), s.label(), s.keyword());
        }
        if (node instanceof Stmt.Continue<?> s) {
            return between(s.keyword(), s.semicolon(), s.label(), s.keyword());
        }
        if (node instanceof Stmt.Throw<?> s) {
            return between(s.keyword(), s.semicolon(), s.expr());
        }
        if (node instanceof Stmt.Var<?> s) {
            return between(s.decls(), s.semicolon(), s.decls());
        }
        if (node instanceof BlockStmt<?> b) {
            return span(b.openBrace(), b.closeBrace());
        }
        if (node instanceof WithStmt<?> w) {
            return span(w.keyword(), w.body());
        }
        if (node instanceof LabeledStmt<?> l) {
            return span(l.label(), l.body());
        }
        if (node instanceof IfStmt<?> i) {
            return between(i.keyword(), i.alternate(), i.consequent());
        }
        if (node instanceof ElseClause<?> e) {
            return span(e.keyword(), e.body());
        }
        if (node instanceof SwitchStmt<?> s) {
            return span(s.keyword(), s.closeBrace());
        }
        if (node instanceof SwitchCase<?> c) {
            return between(c.keyword(), last(c.consequent()), c.colon());
        }
        if (node instanceof TryStmt<?> t) {
            return between(t.keyword(), t.finalizer(), t.handler(), t.block());
        }
        if (node instanceof CatchClause<?> c) {
            return span(c.keyword(), c.body());
        }
        if (node instanceof CatchArg<?> c) {
            return span(c.openParen(), c.closeParen());
        }
        if (node instanceof FinallyClause<?> f) {
            return span(f.keyword(), f.body());
        }
        if (node instanceof WhileStmt<?> w) {
            return span(w.keyword(), w.body());
        }
        if (node instanceof DoWhileStmt<?> d) {
            if (d.semicolon() != null) {
                return span(d.doKeyword(), d.semicolon());
            }
            return new SourceLocation(d.doKeyword().start(), d.closeParen().end().plusColumns(1));
        }
        if (node instanceof ForStmt<?> f) {
            return span(f.keyword(), f.body());
        }
        if (node instanceof ForInStmt<?> f) {
            return span(f.keyword(), f.body());
        }
        if (node instanceof ForOfStmt<?> f) {
            return span(f.keyword(), f.body());
        }
        throw new IllegalArgumentException("No location rule for " + node.getClass().getName());
    }

    /**
     * The span of a list of nodes, or {@link SourceLocation#zero()} when it is empty.
     */
    public static SourceLocation ofList(List<? extends Node> nodes) {
        if (nodes.isEmpty()) {
            return SourceLocation.zero();
        }
        return span(nodes.get(0), nodes.get(nodes.size() - 1));
    }

    private static SourceLocation entry(ListEntry<?> entry) {
        Node item = entry.item();
        Token comma = entry.comma();
        if (item == null) {
            return comma == null ? SourceLocation.zero() : comma.loc();
        }
        return span(item, firstOf(comma, item));
    }

    private static SourceLocation operatorAndArgument(OperatorToken<?> operator, Node argument) {
        Position opStart = operator.start();
        Position argStart = argument.start();
        if (opStart.compareTo(argStart) < 0) {
            return new SourceLocation(opStart, argument.end());
        }
        return new SourceLocation(argStart, operator.end());
    }

    private static SourceLocation span(Node first, Node last) {
        return new SourceLocation(first.start(), last.end());
    }

    /**
     * From the start of {@code first} to the end of the first non-null candidate.
     */
    private static SourceLocation between(Node first, Node... lastCandidates) {
        return span(first, firstOf(lastCandidates));
    }

    private static Node firstOf(Node... candidates) {
        for (Node candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Node is missing every constituent its location needs");
    }

    private static Node first(List<? extends Node> nodes) {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    private static Node last(List<? extends Node> nodes) {
        return nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
    }
}
