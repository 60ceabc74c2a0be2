package com.jsast.spanned;

import com.jsast.ast.ArrayExpression;
import com.jsast.ast.ArrayPattern;
import com.jsast.ast.ArrayPatternElement;
import com.jsast.ast.ArrowBody;
import com.jsast.ast.ArrowFunctionExpression;
import com.jsast.ast.AssignmentExpression;
import com.jsast.ast.AssignmentPattern;
import com.jsast.ast.AssignmentTarget;
import com.jsast.ast.AwaitExpression;
import com.jsast.ast.BinaryExpression;
import com.jsast.ast.BlockStatement;
import com.jsast.ast.BooleanLiteral;
import com.jsast.ast.BreakStatement;
import com.jsast.ast.CallExpression;
import com.jsast.ast.ClassDeclaration;
import com.jsast.ast.ClassExpression;
import com.jsast.ast.ConditionalExpression;
import com.jsast.ast.ContinueStatement;
import com.jsast.ast.DebuggerStatement;
import com.jsast.ast.Declaration;
import com.jsast.ast.Directive;
import com.jsast.ast.DoWhileStatement;
import com.jsast.ast.EmptyStatement;
import com.jsast.ast.ExportAllDeclaration;
import com.jsast.ast.ExportDefaultDeclaration;
import com.jsast.ast.ExportNamedDeclaration;
import com.jsast.ast.ExportSpecifier;
import com.jsast.ast.Expression;
import com.jsast.ast.ExpressionStatement;
import com.jsast.ast.ForInStatement;
import com.jsast.ast.ForInit;
import com.jsast.ast.ForLeft;
import com.jsast.ast.ForOfStatement;
import com.jsast.ast.ForStatement;
import com.jsast.ast.FunctionBody;
import com.jsast.ast.FunctionDeclaration;
import com.jsast.ast.FunctionExpression;
import com.jsast.ast.FunctionParameter;
import com.jsast.ast.Identifier;
import com.jsast.ast.IfStatement;
import com.jsast.ast.ImportClause;
import com.jsast.ast.ImportDeclaration;
import com.jsast.ast.ImportDefaultSpecifier;
import com.jsast.ast.ImportNamespaceSpecifier;
import com.jsast.ast.ImportSpecifier;
import com.jsast.ast.LabeledStatement;
import com.jsast.ast.LogicalExpression;
import com.jsast.ast.MemberExpression;
import com.jsast.ast.MetaProperty;
import com.jsast.ast.NewExpression;
import com.jsast.ast.NullLiteral;
import com.jsast.ast.NumberLiteral;
import com.jsast.ast.ObjectExpression;
import com.jsast.ast.ObjectMember;
import com.jsast.ast.ObjectPattern;
import com.jsast.ast.ObjectPatternPart;
import com.jsast.ast.Pattern;
import com.jsast.ast.Property;
import com.jsast.ast.PropertyKey;
import com.jsast.ast.PropertyKind;
import com.jsast.ast.PropertyValue;
import com.jsast.ast.RegExpLiteral;
import com.jsast.ast.RestElement;
import com.jsast.ast.ReturnStatement;
import com.jsast.ast.SequenceExpression;
import com.jsast.ast.SpreadElement;
import com.jsast.ast.Statement;
import com.jsast.ast.StringLiteral;
import com.jsast.ast.Super;
import com.jsast.ast.SwitchStatement;
import com.jsast.ast.TaggedTemplateExpression;
import com.jsast.ast.TemplateLiteral;
import com.jsast.ast.ThisExpression;
import com.jsast.ast.ThrowStatement;
import com.jsast.ast.TryStatement;
import com.jsast.ast.UnaryExpression;
import com.jsast.ast.UpdateExpression;
import com.jsast.ast.VariableDeclaration;
import com.jsast.ast.VariableDeclarator;
import com.jsast.ast.WhileStatement;
import com.jsast.ast.WithStatement;
import com.jsast.ast.YieldExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Converts a spanned tree into the equivalent plain tree.
 *
 * <p>Locations and punctuation are dropped, source text is carried over untouched, and
 * parenthesized expressions are unwrapped. Facts that the spanned tree only encodes in
 * its tokens (whether an operator is prefix, whether a member access is computed, whether
 * an arrow body is an expression) become plain fields. Leading non-empty string literal
 * statements of program and function bodies become {@link Directive}s.</p>
 *
 * <p>Conversion is total over finished trees. Meeting an {@link ArrowParamPlaceholder}
 * throws {@link MalformedTreeException}.</p>
 */
public final class PlainTreeConverter {

    private PlainTreeConverter() {
    }

    public static <T extends CharSequence> com.jsast.ast.Program<T> convert(Program<T> program) {
        return new com.jsast.ast.Program<>(prologueBody(program.body()), program.sourceType());
    }

    // ==================== Bodies ====================

    /**
     * Converts a program or function body, splitting out its directive prologue.
     */
    static <T extends CharSequence> List<com.jsast.ast.ProgramPart<T>> prologueBody(List<ProgramPart<T>> parts) {
        List<com.jsast.ast.ProgramPart<T>> out = new ArrayList<>(parts.size());
        boolean inPrologue = true;
        for (ProgramPart<T> part : parts) {
            if (inPrologue) {
                StringLit<T> literal = prologueLiteral(part);
                if (literal == null) {
                    inPrologue = false;
                } else if (literal.content().source().length() > 0) {
                    out.add(new Directive<>(stringLiteral(literal), literal.content().source()));
                    continue;
                }
            }
            out.add(programPart(part));
        }
        return Collections.unmodifiableList(out);
    }

    private static <T extends CharSequence> StringLit<T> prologueLiteral(ProgramPart<T> part) {
        if (part instanceof Dir<T> dir) {
            return dir.expr();
        }
        if (part instanceof Stmt.ExprStmt<T> stmt && stmt.expr() instanceof StringLit<T> literal) {
            return literal;
        }
        return null;
    }

    private static <T extends CharSequence> List<com.jsast.ast.ProgramPart<T>> parts(List<ProgramPart<T>> parts) {
        return map(parts, PlainTreeConverter::programPart);
    }

    public static <T extends CharSequence> com.jsast.ast.ProgramPart<T> programPart(ProgramPart<T> part) {
        if (part instanceof Dir<T> dir) {
            // only a prologue makes a directive
            return new ExpressionStatement<>(stringLiteral(dir.expr()));
        }
        if (part instanceof Decl<T> decl) {
            return declaration(decl);
        }
        return statement((Stmt<T>) part);
    }

    // ==================== Declarations ====================

    public static <T extends CharSequence> Declaration<T> declaration(Decl<T> decl) {
        if (decl instanceof Decl.Var<T> varDecl) {
            return variableDeclaration(varDecl.decls());
        }
        if (decl instanceof Func<T> func) {
            return new FunctionDeclaration<>(
                identifierOrNull(func.id()), params(func.params()), functionBody(func.body()),
                func.isGenerator(), func.isAsync());
        }
        if (decl instanceof ClassDef<T> classDef) {
            return new ClassDeclaration<>(
                identifierOrNull(classDef.id()), superClass(classDef.superClass()), classBody(classDef.body()));
        }
        if (decl instanceof Decl.Import<T> imp) {
            return importDeclaration(imp.specifier());
        }
        return exportDeclaration(((Decl.Export<T>) decl).specifier());
    }

    private static <T extends CharSequence> VariableDeclaration<T> variableDeclaration(VarDecls<T> decls) {
        List<VariableDeclarator<T>> declarators = map(items(decls.decls()), PlainTreeConverter::declarator);
        return new VariableDeclaration<>(decls.keyword().operator(), declarators);
    }

    private static <T extends CharSequence> VariableDeclarator<T> declarator(VarDecl<T> decl) {
        return new VariableDeclarator<>(pattern(decl.id()), expressionOrNull(decl.init()));
    }

    private static <T extends CharSequence> ImportDeclaration<T> importDeclaration(ModImport<T> imp) {
        List<ImportClause<T>> specifiers = new ArrayList<>();
        for (ImportSpec<T> spec : items(imp.specifiers())) {
            if (spec instanceof ImportSpec.Normal<T> normal) {
                for (NormalImportSpec<T> named : items(normal.specs())) {
                    specifiers.add(new ImportSpecifier<>(identifier(named.imported()), aliasOrNull(named.alias())));
                }
            } else if (spec instanceof ImportSpec.Default<T> def) {
                specifiers.add(new ImportDefaultSpecifier<>(identifier(def.local())));
            } else if (spec instanceof ImportSpec.Namespace<T> namespace) {
                specifiers.add(new ImportNamespaceSpecifier<>(identifier(namespace.local())));
            }
        }
        return new ImportDeclaration<>(Collections.unmodifiableList(specifiers), stringLiteral(imp.source()));
    }

    private static <T extends CharSequence> Declaration<T> exportDeclaration(ModExport<T> export) {
        ModExportSpec<T> spec = export.spec();
        if (spec instanceof ModExportSpec.DefaultDecl<T> def) {
            return new ExportDefaultDeclaration<>(declaration(def.decl()));
        }
        if (spec instanceof ModExportSpec.DefaultExpr<T> def) {
            return new ExportDefaultDeclaration<>(expression(def.expr()));
        }
        if (spec instanceof ModExportSpec.NamedDecl<T> named) {
            return new ExportNamedDeclaration<>(declaration(named.decl()), List.of(), null);
        }
        if (spec instanceof ModExportSpec.NamedList<T> list) {
            List<ExportSpecifier<T>> specifiers = new ArrayList<>();
            for (NamedExport<T> named : items(list.specs())) {
                specifiers.add(new ExportSpecifier<>(identifier(named.local()), aliasOrNull(named.alias())));
            }
            return new ExportNamedDeclaration<>(null, specifiers, stringLiteralOrNull(list.source()));
        }
        ModExportSpec.All<T> all = (ModExportSpec.All<T>) spec;
        return new ExportAllDeclaration<>(aliasOrNull(all.alias()), stringLiteral(all.source()));
    }

    // ==================== Statements ====================

    public static <T extends CharSequence> Statement<T> statement(Stmt<T> stmt) {
        if (stmt instanceof Stmt.ExprStmt<T> s) {
            return new ExpressionStatement<>(expression(s.expr()));
        }
        if (stmt instanceof Stmt.Empty<T>) {
            return new EmptyStatement<>();
        }
        if (stmt instanceof Stmt.Debugger<T>) {
            return new DebuggerStatement<>();
        }
        if (stmt instanceof Stmt.Return<T> s) {
            return new ReturnStatement<>(expressionOrNull(s.value()));
        }
        if (stmt instanceof Stmt.Break<T> s) {
            return new BreakStatement<>(identifierOrNull(s.label()));
        }
        if (stmt instanceof Stmt.Continue<T> s) {
            return new ContinueStatement<>(identifierOrNull(s.label()));
        }
        if (stmt instanceof Stmt.Throw<T> s) {
            return new ThrowStatement<>(expression(s.expr()));
        }
        if (stmt instanceof Stmt.Var<T> s) {
            return variableDeclaration(s.decls());
        }
        if (stmt instanceof BlockStmt<T> s) {
            return block(s);
        }
        if (stmt instanceof WithStmt<T> s) {
            return new WithStatement<>(expression(s.object()), statement(s.body()));
        }
        if (stmt instanceof LabeledStmt<T> s) {
            return new LabeledStatement<>(identifier(s.label()), statement(s.body()));
        }
        if (stmt instanceof IfStmt<T> s) {
            Statement<T> alternate = s.alternate() == null ? null : statement(s.alternate().body());
            return new IfStatement<>(expression(s.test()), statement(s.consequent()), alternate);
        }
        if (stmt instanceof SwitchStmt<T> s) {
            List<com.jsast.ast.SwitchCase<T>> cases = map(s.cases(), PlainTreeConverter::switchCase);
            return new SwitchStatement<>(expression(s.discriminant()), cases);
        }
        if (stmt instanceof TryStmt<T> s) {
            return tryStatement(s);
        }
        if (stmt instanceof WhileStmt<T> s) {
            return new WhileStatement<>(expression(s.test()), statement(s.body()));
        }
        if (stmt instanceof DoWhileStmt<T> s) {
            return new DoWhileStatement<>(statement(s.body()), expression(s.test()));
        }
        if (stmt instanceof ForStmt<T> s) {
            ForInit<T> init = s.init() == null ? null : forInit(s.init());
            return new ForStatement<>(init, expressionOrNull(s.test()), expressionOrNull(s.update()),
                statement(s.body()));
        }
        if (stmt instanceof ForInStmt<T> s) {
            return new ForInStatement<>(forLeft(s.left()), expression(s.right()), statement(s.body()));
        }
        ForOfStmt<T> s = (ForOfStmt<T>) stmt;
        return new ForOfStatement<>(forLeft(s.left()), expression(s.right()), statement(s.body()),
            s.awaitKeyword() != null);
    }

    private static <T extends CharSequence> com.jsast.ast.SwitchCase<T> switchCase(SwitchCase<T> switchCase) {
        return new com.jsast.ast.SwitchCase<>(expressionOrNull(switchCase.test()), parts(switchCase.consequent()));
    }

    private static <T extends CharSequence> BlockStatement<T> block(BlockStmt<T> block) {
        return new BlockStatement<>(parts(block.stmts()));
    }

    private static <T extends CharSequence> TryStatement<T> tryStatement(TryStmt<T> stmt) {
        com.jsast.ast.CatchClause<T> handler = null;
        if (stmt.handler() != null) {
            CatchArg<T> param = stmt.handler().param();
            handler = new com.jsast.ast.CatchClause<>(
                param == null ? null : pattern(param.param()), block(stmt.handler().body()));
        }
        BlockStatement<T> finalizer = stmt.finalizer() == null ? null : block(stmt.finalizer().body());
        return new TryStatement<>(block(stmt.block()), handler, finalizer);
    }

    private static <T extends CharSequence> ForInit<T> forInit(LoopInit<T> init) {
        if (init instanceof VarDecls<T> decls) {
            return variableDeclaration(decls);
        }
        return expression((Expr<T>) init);
    }

    private static <T extends CharSequence> ForLeft<T> forLeft(LoopLeft<T> left) {
        if (left instanceof LoopVar<T> loopVar) {
            List<VariableDeclarator<T>> declarators = List.of(declarator(loopVar.decl()));
            return new VariableDeclaration<>(loopVar.keyword().operator(), declarators);
        }
        if (left instanceof Expr<T> expr) {
            return expression(expr);
        }
        return pattern((Pat<T>) left);
    }

    // ==================== Expressions ====================

    public static <T extends CharSequence> Expression<T> expression(Expr<T> expr) {
        if (expr instanceof WrappedExpr<T> wrapped) {
            return expression(wrapped.expr());
        }
        if (expr instanceof ArrowParamPlaceholder<T> placeholder) {
            throw new MalformedTreeException("Arrow parameter placeholder reached conversion", placeholder);
        }
        if (expr instanceof Ident<T> ident) {
            return identifier(ident);
        }
        if (expr instanceof Lit<T> lit) {
            return literal(lit);
        }
        if (expr instanceof Expr.This<T>) {
            return new ThisExpression<>();
        }
        if (expr instanceof Expr.Super<T>) {
            return new Super<>();
        }
        if (expr instanceof ArrayExpr<T> array) {
            List<Expression<T>> elements = map(array.elements(), PlainTreeConverter::element);
            return new ArrayExpression<>(elements);
        }
        if (expr instanceof ObjExpr<T> obj) {
            List<ObjectMember<T>> members = map(items(obj.props()), PlainTreeConverter::objectMember);
            return new ObjectExpression<>(members);
        }
        if (expr instanceof Func<T> func) {
            return functionExpression(func);
        }
        if (expr instanceof ArrowFuncExpr<T> arrow) {
            return arrowFunction(arrow);
        }
        if (expr instanceof ClassDef<T> classDef) {
            return new ClassExpression<>(
                identifierOrNull(classDef.id()), superClass(classDef.superClass()), classBody(classDef.body()));
        }
        if (expr instanceof TaggedTemplateExpr<T> tagged) {
            return new TaggedTemplateExpression<>(expression(tagged.tag()), templateLiteral(tagged.quasi()));
        }
        if (expr instanceof UnaryExpr<T> unary) {
            return new UnaryExpression<>(unary.operator().operator(), unary.isPrefix(), expression(unary.argument()));
        }
        if (expr instanceof UpdateExpr<T> update) {
            return new UpdateExpression<>(update.operator().operator(), expression(update.argument()), update.isPrefix());
        }
        if (expr instanceof BinaryExpr<T> binary) {
            return new BinaryExpression<>(
                binary.operator().operator(), expression(binary.left()), expression(binary.right()));
        }
        if (expr instanceof LogicalExpr<T> logical) {
            return new LogicalExpression<>(
                logical.operator().operator(), expression(logical.left()), expression(logical.right()));
        }
        if (expr instanceof AssignExpr<T> assign) {
            return new AssignmentExpression<>(
                assign.operator().operator(), assignmentTarget(assign.left()), expression(assign.right()));
        }
        if (expr instanceof MemberExpr<T> member) {
            return new MemberExpression<>(
                expression(member.object()), expression(member.property()), member.isComputed());
        }
        if (expr instanceof ConditionalExpr<T> conditional) {
            return new ConditionalExpression<>(expression(conditional.test()),
                expression(conditional.consequent()), expression(conditional.alternate()));
        }
        if (expr instanceof CallExpr<T> call) {
            return new CallExpression<>(expression(call.callee()), expressions(call.arguments()));
        }
        if (expr instanceof NewExpr<T> newExpr) {
            List<Expression<T>> arguments = newExpr.arguments() == null ? List.of() : expressions(newExpr.arguments());
            return new NewExpression<>(expression(newExpr.callee()), arguments);
        }
        if (expr instanceof SequenceExpr<T> sequence) {
            return new SequenceExpression<>(expressions(sequence.exprs()));
        }
        if (expr instanceof SpreadExpr<T> spread) {
            return new SpreadElement<>(expression(spread.expr()));
        }
        if (expr instanceof YieldExpr<T> yieldExpr) {
            return new YieldExpression<>(expressionOrNull(yieldExpr.argument()), yieldExpr.star() != null);
        }
        if (expr instanceof AwaitExpr<T> awaitExpr) {
            return new AwaitExpression<>(expression(awaitExpr.expr()));
        }
        MetaProp<T> meta = (MetaProp<T>) expr;
        return new MetaProperty<>(identifier(meta.meta()), identifier(meta.property()));
    }

    private static <T extends CharSequence> Expression<T> element(ListEntry<Expr<T>> entry) {
        return entry.isHole() ? null : expression(entry.item());
    }

    private static <T extends CharSequence> List<Expression<T>> expressions(List<ListEntry<Expr<T>>> entries) {
        return map(items(entries), PlainTreeConverter::expression);
    }

    private static <T extends CharSequence> Expression<T> expressionOrNull(Expr<T> expr) {
        return expr == null ? null : expression(expr);
    }

    private static <T extends CharSequence> AssignmentTarget<T> assignmentTarget(AssignTarget<T> target) {
        if (target instanceof Expr<T> expr) {
            return expression(expr);
        }
        return pattern((Pat<T>) target);
    }

    private static <T extends CharSequence> Identifier<T> identifier(Ident<T> ident) {
        return new Identifier<>(ident.name());
    }

    private static <T extends CharSequence> Identifier<T> identifierOrNull(Ident<T> ident) {
        return ident == null ? null : identifier(ident);
    }

    private static <T extends CharSequence> Identifier<T> aliasOrNull(Alias<T> alias) {
        return alias == null ? null : identifier(alias.ident());
    }

    private static <T extends CharSequence> Expression<T> superClass(SuperClass<T> superClass) {
        return superClass == null ? null : expression(superClass.expr());
    }

    // ==================== Literals ====================

    private static <T extends CharSequence> Expression<T> literal(Lit<T> lit) {
        if (lit instanceof Lit.Null<T>) {
            return new NullLiteral<>();
        }
        if (lit instanceof Lit.Bool<T> bool) {
            return new BooleanLiteral<>(bool.value());
        }
        if (lit instanceof Lit.Num<T> num) {
            return new NumberLiteral<>(num.raw().source());
        }
        if (lit instanceof StringLit<T> string) {
            return stringLiteral(string);
        }
        if (lit instanceof RegExLit<T> regex) {
            T flags = regex.flags() == null ? null : regex.flags().source();
            return new RegExpLiteral<>(regex.pattern().source(), flags);
        }
        return templateLiteral((TemplateLit<T>) lit);
    }

    private static <T extends CharSequence> StringLiteral<T> stringLiteral(StringLit<T> lit) {
        return new StringLiteral<>(lit.quote(), lit.content().source());
    }

    private static <T extends CharSequence> StringLiteral<T> stringLiteralOrNull(StringLit<T> lit) {
        return lit == null ? null : stringLiteral(lit);
    }

    private static <T extends CharSequence> TemplateLiteral<T> templateLiteral(TemplateLit<T> template) {
        List<com.jsast.ast.TemplateElement<T>> quasis = map(template.quasis(), PlainTreeConverter::quasi);
        List<Expression<T>> expressions = map(template.expressions(), PlainTreeConverter::expression);
        return new TemplateLiteral<>(quasis, expressions);
    }

    private static <T extends CharSequence> com.jsast.ast.TemplateElement<T> quasi(TemplateElement<T> quasi) {
        return new com.jsast.ast.TemplateElement<>(quasi.content().source(), quasi.isTail());
    }

    // ==================== Functions and classes ====================

    private static <T extends CharSequence> FunctionExpression<T> functionExpression(Func<T> func) {
        return new FunctionExpression<>(identifierOrNull(func.id()), params(func.params()),
            functionBody(func.body()), func.isGenerator(), func.isAsync());
    }

    private static <T extends CharSequence> ArrowFunctionExpression<T> arrowFunction(ArrowFuncExpr<T> arrow) {
        ArrowBody<T> body;
        boolean expressionBody;
        if (arrow.body() instanceof FuncBody<T> block) {
            body = functionBody(block);
            expressionBody = false;
        } else {
            body = expression((Expr<T>) arrow.body());
            expressionBody = true;
        }
        return new ArrowFunctionExpression<>(params(arrow.params()), body, expressionBody,
            arrow.asyncKeyword() != null);
    }

    private static <T extends CharSequence> FunctionBody<T> functionBody(FuncBody<T> body) {
        return new FunctionBody<>(prologueBody(body.stmts()));
    }

    private static <T extends CharSequence> List<FunctionParameter<T>> params(List<ListEntry<FuncArg<T>>> params) {
        return map(items(params), PlainTreeConverter::param);
    }

    private static <T extends CharSequence> FunctionParameter<T> param(FuncArg<T> arg) {
        if (arg instanceof RestPat<T> rest) {
            return new RestElement<>(pattern(rest.pat()));
        }
        if (arg instanceof Pat<T> pat) {
            return pattern(pat);
        }
        return expression((Expr<T>) arg);
    }

    private static <T extends CharSequence> com.jsast.ast.ClassBody<T> classBody(ClassBody<T> body) {
        List<Property<T>> members = map(body.props(), PlainTreeConverter::property);
        return new com.jsast.ast.ClassBody<>(members);
    }

    // ==================== Properties ====================

    private static <T extends CharSequence> ObjectMember<T> objectMember(ObjProp<T> prop) {
        if (prop instanceof SpreadExpr<T> spread) {
            return new SpreadElement<>(expression(spread.expr()));
        }
        return property((Prop<T>) prop);
    }

    private static <T extends CharSequence> Property<T> property(Prop<T> prop) {
        if (prop instanceof PropInit<T> init) {
            PropertyValue<T> value = init.value() == null ? null : propertyValue(init.value());
            return new Property<>(propertyKey(init.key()), value, PropertyKind.INIT,
                false, init.key().isComputed(), init.isShorthand(), false);
        }
        if (prop instanceof PropMethod<T> method) {
            return new Property<>(propertyKey(method.id()), methodFunction(method), PropertyKind.METHOD,
                true, method.id().isComputed(), false, method.staticKeyword() != null);
        }
        if (prop instanceof PropCtor<T> ctor) {
            FunctionExpression<T> value = new FunctionExpression<>(
                null, params(ctor.params()), functionBody(ctor.body()), false, false);
            return new Property<>(propertyKey(ctor.keyword()), value, PropertyKind.CONSTRUCTOR,
                false, ctor.keyword().isComputed(), false, false);
        }
        if (prop instanceof PropGet<T> getter) {
            FunctionExpression<T> value = new FunctionExpression<>(
                null, List.of(), functionBody(getter.body()), false, false);
            return new Property<>(propertyKey(getter.id()), value, PropertyKind.GET,
                false, getter.id().isComputed(), false, getter.staticKeyword() != null);
        }
        PropSet<T> setter = (PropSet<T>) prop;
        List<FunctionParameter<T>> setterParams = setter.arg() == null || setter.arg().isHole()
            ? List.of()
            : List.of(param(setter.arg().item()));
        FunctionExpression<T> value = new FunctionExpression<>(
            null, setterParams, functionBody(setter.body()), false, false);
        return new Property<>(propertyKey(setter.id()), value, PropertyKind.SET,
            false, setter.id().isComputed(), false, setter.staticKeyword() != null);
    }

    private static <T extends CharSequence> FunctionExpression<T> methodFunction(PropMethod<T> method) {
        return new FunctionExpression<>(null, params(method.params()), functionBody(method.body()),
            method.star() != null, method.asyncKeyword() != null);
    }

    private static <T extends CharSequence> PropertyKey<T> propertyKey(PropInitKey<T> key) {
        if (key.value() instanceof Expr<T> expr) {
            return expression(expr);
        }
        return pattern((Pat<T>) key.value());
    }

    private static <T extends CharSequence> PropertyValue<T> propertyValue(PropValue<T> value) {
        if (value instanceof PropMethod<T> method) {
            return methodFunction(method);
        }
        if (value instanceof Expr<T> expr) {
            return expression(expr);
        }
        return pattern((Pat<T>) value);
    }

    // ==================== Patterns ====================

    public static <T extends CharSequence> Pattern<T> pattern(Pat<T> pat) {
        if (pat instanceof Ident<T> ident) {
            return identifier(ident);
        }
        if (pat instanceof ObjPat<T> obj) {
            List<ObjectPatternPart<T>> parts = map(items(obj.props()), PlainTreeConverter::objectPatternPart);
            return new ObjectPattern<>(parts);
        }
        if (pat instanceof ArrayPat<T> array) {
            List<ArrayPatternElement<T>> elements = new ArrayList<>(array.elements().size());
            for (ListEntry<ArrayPatPart<T>> entry : array.elements()) {
                elements.add(entry.isHole() ? null : arrayPatternElement(entry.item()));
            }
            return new ArrayPattern<>(Collections.unmodifiableList(elements));
        }
        AssignPat<T> assign = (AssignPat<T>) pat;
        return new AssignmentPattern<>(pattern(assign.left()), expression(assign.right()));
    }

    private static <T extends CharSequence> ObjectPatternPart<T> objectPatternPart(ObjPatPart<T> part) {
        if (part instanceof RestPat<T> rest) {
            return new RestElement<>(pattern(rest.pat()));
        }
        return property((Prop<T>) part);
    }

    private static <T extends CharSequence> ArrayPatternElement<T> arrayPatternElement(ArrayPatPart<T> part) {
        if (part instanceof RestPat<T> rest) {
            return new RestElement<>(pattern(rest.pat()));
        }
        if (part instanceof Pat<T> pat) {
            return pattern(pat);
        }
        return expression((Expr<T>) part);
    }

    // ==================== Lists ====================

    private static <I extends Node> List<I> items(List<ListEntry<I>> entries) {
        return map(entries, ListEntry::item);
    }

    /**
     * Maps into an unmodifiable list; null results (elided elements) are kept.
     */
    private static <A, B> List<B> map(List<A> list, Function<? super A, ? extends B> f) {
        List<B> out = new ArrayList<>(list.size());
        for (A a : list) {
            out.add(f.apply(a));
        }
        return Collections.unmodifiableList(out);
    }
}
