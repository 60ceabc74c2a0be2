package com.jsast.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Rebuilds a plain tree over a different text storage.
 *
 * <p>The shape of the tree is kept node for node; only the text leaves (names, raw
 * literals, directives, template chunks) pass through the mapping function. The usual
 * use is {@link #toOwned}, which copies a tree of {@link SourceSlice}s into one of
 * {@code String}s so that the source buffer can be released.</p>
 *
 * @param <T> the text storage of the input tree
 * @param <U> the text storage of the output tree
 */
public final class TreeText<T extends CharSequence, U extends CharSequence> {

    private final Function<? super T, ? extends U> text;

    private TreeText(Function<? super T, ? extends U> text) {
        this.text = text;
    }

    /**
     * Copies every text leaf of {@code program} into a fresh {@code String}.
     */
    public static <T extends CharSequence> Program<String> toOwned(Program<T> program) {
        return mapText(program, CharSequence::toString);
    }

    public static <T extends CharSequence, U extends CharSequence> Program<U> mapText(
            Program<T> program, Function<? super T, ? extends U> text) {
        Objects.requireNonNull(text, "text");
        return new TreeText<T, U>(text).program(program);
    }

    private U text(T value) {
        return value == null ? null : text.apply(value);
    }

    // ==================== Program and bodies ====================

    private Program<U> program(Program<T> program) {
        return new Program<>(map(program.body(), this::programPart), program.sourceType());
    }

    private ProgramPart<U> programPart(ProgramPart<T> part) {
        if (part instanceof Directive<T> directive) {
            return new Directive<>(stringLiteral(directive.expression()), text(directive.directive()));
        }
        if (part instanceof Declaration<T> declaration) {
            return declaration(declaration);
        }
        return statement((Statement<T>) part);
    }

    private FunctionBody<U> functionBody(FunctionBody<T> body) {
        return new FunctionBody<>(map(body.body(), this::programPart));
    }

    private BlockStatement<U> block(BlockStatement<T> block) {
        return block == null ? null : new BlockStatement<>(map(block.body(), this::programPart));
    }

    // ==================== Declarations ====================

    private Declaration<U> declaration(Declaration<T> decl) {
        if (decl == null) {
            return null;
        }
        if (decl instanceof VariableDeclaration<T> variables) {
            return variableDeclaration(variables);
        }
        if (decl instanceof FunctionDeclaration<T> func) {
            return new FunctionDeclaration<>(identifier(func.id()), map(func.params(), this::parameter),
                functionBody(func.body()), func.generator(), func.async());
        }
        if (decl instanceof ClassDeclaration<T> classDecl) {
            return new ClassDeclaration<>(identifier(classDecl.id()), expression(classDecl.superClass()),
                classBody(classDecl.body()));
        }
        if (decl instanceof ImportDeclaration<T> imp) {
            return new ImportDeclaration<>(map(imp.specifiers(), this::importClause), stringLiteral(imp.source()));
        }
        if (decl instanceof ExportNamedDeclaration<T> named) {
            return new ExportNamedDeclaration<>(declaration(named.declaration()),
                map(named.specifiers(), this::exportSpecifier), stringLiteral(named.source()));
        }
        if (decl instanceof ExportDefaultDeclaration<T> def) {
            DefaultExportable<T> exported = def.declaration();
            DefaultExportable<U> mapped = exported instanceof Declaration<T> d
                ? declaration(d)
                : expression((Expression<T>) exported);
            return new ExportDefaultDeclaration<>(mapped);
        }
        ExportAllDeclaration<T> all = (ExportAllDeclaration<T>) decl;
        return new ExportAllDeclaration<>(identifier(all.exported()), stringLiteral(all.source()));
    }

    private VariableDeclaration<U> variableDeclaration(VariableDeclaration<T> decl) {
        return new VariableDeclaration<>(decl.kind(), map(decl.declarations(), this::declarator));
    }

    private VariableDeclarator<U> declarator(VariableDeclarator<T> decl) {
        return new VariableDeclarator<>(pattern(decl.id()), expression(decl.init()));
    }

    private ImportClause<U> importClause(ImportClause<T> clause) {
        if (clause instanceof ImportSpecifier<T> spec) {
            return new ImportSpecifier<>(identifier(spec.imported()), identifier(spec.local()));
        }
        if (clause instanceof ImportDefaultSpecifier<T> spec) {
            return new ImportDefaultSpecifier<>(identifier(spec.local()));
        }
        return new ImportNamespaceSpecifier<>(identifier(((ImportNamespaceSpecifier<T>) clause).local()));
    }

    private ExportSpecifier<U> exportSpecifier(ExportSpecifier<T> spec) {
        return new ExportSpecifier<>(identifier(spec.local()), identifier(spec.exported()));
    }

    // ==================== Statements ====================

    private Statement<U> statement(Statement<T> stmt) {
        if (stmt == null) {
            return null;
        }
        if (stmt instanceof ExpressionStatement<T> s) {
            return new ExpressionStatement<>(expression(s.expression()));
        }
        if (stmt instanceof BlockStatement<T> s) {
            return block(s);
        }
        if (stmt instanceof EmptyStatement<T>) {
            return new EmptyStatement<>();
        }
        if (stmt instanceof DebuggerStatement<T>) {
            return new DebuggerStatement<>();
        }
        if (stmt instanceof WithStatement<T> s) {
            return new WithStatement<>(expression(s.object()), statement(s.body()));
        }
        if (stmt instanceof ReturnStatement<T> s) {
            return new ReturnStatement<>(expression(s.argument()));
        }
        if (stmt instanceof LabeledStatement<T> s) {
            return new LabeledStatement<>(identifier(s.label()), statement(s.body()));
        }
        if (stmt instanceof BreakStatement<T> s) {
            return new BreakStatement<>(identifier(s.label()));
        }
        if (stmt instanceof ContinueStatement<T> s) {
            return new ContinueStatement<>(identifier(s.label()));
        }
        if (stmt instanceof IfStatement<T> s) {
            return new IfStatement<>(expression(s.test()), statement(s.consequent()), statement(s.alternate()));
        }
        if (stmt instanceof SwitchStatement<T> s) {
            return new SwitchStatement<>(expression(s.discriminant()), map(s.cases(), this::switchCase));
        }
        if (stmt instanceof ThrowStatement<T> s) {
            return new ThrowStatement<>(expression(s.argument()));
        }
        if (stmt instanceof TryStatement<T> s) {
            CatchClause<U> handler = s.handler() == null
                ? null
                : new CatchClause<>(pattern(s.handler().param()), block(s.handler().body()));
            return new TryStatement<>(block(s.block()), handler, block(s.finalizer()));
        }
        if (stmt instanceof WhileStatement<T> s) {
            return new WhileStatement<>(expression(s.test()), statement(s.body()));
        }
        if (stmt instanceof DoWhileStatement<T> s) {
            return new DoWhileStatement<>(statement(s.body()), expression(s.test()));
        }
        if (stmt instanceof ForStatement<T> s) {
            ForInit<U> init = s.init() instanceof VariableDeclaration<T> decl
                ? variableDeclaration(decl)
                : expression((Expression<T>) s.init());
            return new ForStatement<>(init, expression(s.test()), expression(s.update()), statement(s.body()));
        }
        if (stmt instanceof ForInStatement<T> s) {
            return new ForInStatement<>(forLeft(s.left()), expression(s.right()), statement(s.body()));
        }
        if (stmt instanceof ForOfStatement<T> s) {
            return new ForOfStatement<>(forLeft(s.left()), expression(s.right()), statement(s.body()), s.await());
        }
        return variableDeclaration((VariableDeclaration<T>) stmt);
    }

    private SwitchCase<U> switchCase(SwitchCase<T> switchCase) {
        return new SwitchCase<>(expression(switchCase.test()), map(switchCase.consequent(), this::programPart));
    }

    private ForLeft<U> forLeft(ForLeft<T> left) {
        if (left instanceof VariableDeclaration<T> decl) {
            return variableDeclaration(decl);
        }
        if (left instanceof Pattern<T> pat) {
            return pattern(pat);
        }
        return expression((Expression<T>) left);
    }

    // ==================== Expressions ====================

    private Expression<U> expression(Expression<T> expr) {
        if (expr == null) {
            return null;
        }
        if (expr instanceof Identifier<T> ident) {
            return identifier(ident);
        }
        if (expr instanceof Literal<T> lit) {
            return literal(lit);
        }
        if (expr instanceof ThisExpression<T>) {
            return new ThisExpression<>();
        }
        if (expr instanceof Super<T>) {
            return new Super<>();
        }
        if (expr instanceof ArrayExpression<T> array) {
            return new ArrayExpression<>(map(array.elements(), this::expression));
        }
        if (expr instanceof ObjectExpression<T> obj) {
            return new ObjectExpression<>(map(obj.properties(), this::objectMember));
        }
        if (expr instanceof FunctionExpression<T> func) {
            return functionExpression(func);
        }
        if (expr instanceof ArrowFunctionExpression<T> arrow) {
            ArrowBody<U> body = arrow.body() instanceof FunctionBody<T> block
                ? functionBody(block)
                : expression((Expression<T>) arrow.body());
            return new ArrowFunctionExpression<>(map(arrow.params(), this::parameter), body,
                arrow.expression(), arrow.async());
        }
        if (expr instanceof ClassExpression<T> classExpr) {
            return new ClassExpression<>(identifier(classExpr.id()), expression(classExpr.superClass()),
                classBody(classExpr.body()));
        }
        if (expr instanceof TaggedTemplateExpression<T> tagged) {
            return new TaggedTemplateExpression<>(expression(tagged.tag()), templateLiteral(tagged.quasi()));
        }
        if (expr instanceof TemplateLiteral<T> template) {
            return templateLiteral(template);
        }
        if (expr instanceof UnaryExpression<T> unary) {
            return new UnaryExpression<>(unary.operator(), unary.prefix(), expression(unary.argument()));
        }
        if (expr instanceof UpdateExpression<T> update) {
            return new UpdateExpression<>(update.operator(), expression(update.argument()), update.prefix());
        }
        if (expr instanceof BinaryExpression<T> binary) {
            return new BinaryExpression<>(binary.operator(), expression(binary.left()), expression(binary.right()));
        }
        if (expr instanceof AssignmentExpression<T> assign) {
            AssignmentTarget<U> left = assign.left() instanceof Pattern<T> pat
                ? pattern(pat)
                : expression((Expression<T>) assign.left());
            return new AssignmentExpression<>(assign.operator(), left, expression(assign.right()));
        }
        if (expr instanceof LogicalExpression<T> logical) {
            return new LogicalExpression<>(logical.operator(), expression(logical.left()),
                expression(logical.right()));
        }
        if (expr instanceof MemberExpression<T> member) {
            return new MemberExpression<>(expression(member.object()), expression(member.property()),
                member.computed());
        }
        if (expr instanceof ConditionalExpression<T> conditional) {
            return new ConditionalExpression<>(expression(conditional.test()),
                expression(conditional.consequent()), expression(conditional.alternate()));
        }
        if (expr instanceof CallExpression<T> call) {
            return new CallExpression<>(expression(call.callee()), map(call.arguments(), this::expression));
        }
        if (expr instanceof NewExpression<T> newExpr) {
            return new NewExpression<>(expression(newExpr.callee()), map(newExpr.arguments(), this::expression));
        }
        if (expr instanceof SequenceExpression<T> sequence) {
            return new SequenceExpression<>(map(sequence.expressions(), this::expression));
        }
        if (expr instanceof SpreadElement<T> spread) {
            return new SpreadElement<>(expression(spread.argument()));
        }
        if (expr instanceof YieldExpression<T> yieldExpr) {
            return new YieldExpression<>(expression(yieldExpr.argument()), yieldExpr.delegate());
        }
        if (expr instanceof AwaitExpression<T> awaitExpr) {
            return new AwaitExpression<>(expression(awaitExpr.argument()));
        }
        MetaProperty<T> meta = (MetaProperty<T>) expr;
        return new MetaProperty<>(identifier(meta.meta()), identifier(meta.property()));
    }

    private Identifier<U> identifier(Identifier<T> ident) {
        return ident == null ? null : new Identifier<>(text(ident.name()));
    }

    private Literal<U> literal(Literal<T> lit) {
        if (lit instanceof NullLiteral<T>) {
            return new NullLiteral<>();
        }
        if (lit instanceof BooleanLiteral<T> bool) {
            return new BooleanLiteral<>(bool.value());
        }
        if (lit instanceof NumberLiteral<T> num) {
            return new NumberLiteral<>(text(num.raw()));
        }
        if (lit instanceof StringLiteral<T> string) {
            return stringLiteral(string);
        }
        RegExpLiteral<T> regex = (RegExpLiteral<T>) lit;
        return new RegExpLiteral<>(text(regex.pattern()), text(regex.flags()));
    }

    private StringLiteral<U> stringLiteral(StringLiteral<T> lit) {
        return lit == null ? null : new StringLiteral<>(lit.quote(), text(lit.content()));
    }

    private TemplateLiteral<U> templateLiteral(TemplateLiteral<T> template) {
        return new TemplateLiteral<>(
            map(template.quasis(), this::templateElement),
            map(template.expressions(), this::expression));
    }

    private TemplateElement<U> templateElement(TemplateElement<T> quasi) {
        return new TemplateElement<>(text(quasi.raw()), quasi.tail());
    }

    // ==================== Functions, classes and properties ====================

    private FunctionExpression<U> functionExpression(FunctionExpression<T> func) {
        return new FunctionExpression<>(identifier(func.id()), map(func.params(), this::parameter),
            functionBody(func.body()), func.generator(), func.async());
    }

    private FunctionParameter<U> parameter(FunctionParameter<T> param) {
        if (param instanceof RestElement<T> rest) {
            return restElement(rest);
        }
        if (param instanceof Pattern<T> pat) {
            return pattern(pat);
        }
        return expression((Expression<T>) param);
    }

    private ClassBody<U> classBody(ClassBody<T> body) {
        return new ClassBody<>(map(body.body(), this::property));
    }

    private ObjectMember<U> objectMember(ObjectMember<T> member) {
        if (member instanceof SpreadElement<T> spread) {
            return new SpreadElement<>(expression(spread.argument()));
        }
        return property((Property<T>) member);
    }

    private Property<U> property(Property<T> prop) {
        PropertyKey<U> key = prop.key() instanceof Pattern<T> pat
            ? pattern(pat)
            : expression((Expression<T>) prop.key());
        PropertyValue<U> value;
        if (prop.value() == null) {
            value = null;
        } else if (prop.value() instanceof Pattern<T> pat) {
            value = pattern(pat);
        } else {
            value = expression((Expression<T>) prop.value());
        }
        return new Property<>(key, value, prop.kind(), prop.method(), prop.computed(), prop.shorthand(),
            prop.isStatic());
    }

    // ==================== Patterns ====================

    private Pattern<U> pattern(Pattern<T> pat) {
        if (pat == null) {
            return null;
        }
        if (pat instanceof Identifier<T> ident) {
            return identifier(ident);
        }
        if (pat instanceof ObjectPattern<T> obj) {
            return new ObjectPattern<>(map(obj.properties(), this::objectPatternPart));
        }
        if (pat instanceof ArrayPattern<T> array) {
            return new ArrayPattern<>(map(array.elements(), this::arrayPatternElement));
        }
        AssignmentPattern<T> assign = (AssignmentPattern<T>) pat;
        return new AssignmentPattern<>(pattern(assign.left()), expression(assign.right()));
    }

    private ObjectPatternPart<U> objectPatternPart(ObjectPatternPart<T> part) {
        if (part instanceof RestElement<T> rest) {
            return restElement(rest);
        }
        return property((Property<T>) part);
    }

    private ArrayPatternElement<U> arrayPatternElement(ArrayPatternElement<T> element) {
        if (element == null) {
            return null;
        }
        if (element instanceof RestElement<T> rest) {
            return restElement(rest);
        }
        if (element instanceof Pattern<T> pat) {
            return pattern(pat);
        }
        return expression((Expression<T>) element);
    }

    private RestElement<U> restElement(RestElement<T> rest) {
        return new RestElement<>(pattern(rest.argument()));
    }

    /**
     * Maps into an unmodifiable list; null elements (holes) stay null.
     */
    private static <A, B> List<B> map(List<A> list, Function<? super A, ? extends B> f) {
        List<B> out = new ArrayList<>(list.size());
        for (A a : list) {
            out.add(a == null ? null : f.apply(a));
        }
        return Collections.unmodifiableList(out);
    }
}
