package com.jsast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.jsast.ast.ArrayExpression;
import com.jsast.ast.ArrayPattern;
import com.jsast.ast.ArrowFunctionExpression;
import com.jsast.ast.AssignmentExpression;
import com.jsast.ast.AssignmentPattern;
import com.jsast.ast.AwaitExpression;
import com.jsast.ast.BinaryExpression;
import com.jsast.ast.BlockStatement;
import com.jsast.ast.BooleanLiteral;
import com.jsast.ast.BreakStatement;
import com.jsast.ast.CallExpression;
import com.jsast.ast.CatchClause;
import com.jsast.ast.ClassBody;
import com.jsast.ast.ClassDeclaration;
import com.jsast.ast.ClassExpression;
import com.jsast.ast.ConditionalExpression;
import com.jsast.ast.ContinueStatement;
import com.jsast.ast.DebuggerStatement;
import com.jsast.ast.Directive;
import com.jsast.ast.DoWhileStatement;
import com.jsast.ast.EmptyStatement;
import com.jsast.ast.ExportAllDeclaration;
import com.jsast.ast.ExportDefaultDeclaration;
import com.jsast.ast.ExportNamedDeclaration;
import com.jsast.ast.ExportSpecifier;
import com.jsast.ast.ExpressionStatement;
import com.jsast.ast.ForInStatement;
import com.jsast.ast.ForOfStatement;
import com.jsast.ast.ForStatement;
import com.jsast.ast.FunctionBody;
import com.jsast.ast.FunctionDeclaration;
import com.jsast.ast.FunctionExpression;
import com.jsast.ast.Identifier;
import com.jsast.ast.IfStatement;
import com.jsast.ast.ImportDeclaration;
import com.jsast.ast.ImportDefaultSpecifier;
import com.jsast.ast.ImportNamespaceSpecifier;
import com.jsast.ast.ImportSpecifier;
import com.jsast.ast.LabeledStatement;
import com.jsast.ast.Literal;
import com.jsast.ast.LogicalExpression;
import com.jsast.ast.MemberExpression;
import com.jsast.ast.MetaProperty;
import com.jsast.ast.NewExpression;
import com.jsast.ast.Node;
import com.jsast.ast.NullLiteral;
import com.jsast.ast.NumberLiteral;
import com.jsast.ast.ObjectExpression;
import com.jsast.ast.ObjectPattern;
import com.jsast.ast.Program;
import com.jsast.ast.Property;
import com.jsast.ast.PropertyKind;
import com.jsast.ast.RegExpLiteral;
import com.jsast.ast.RestElement;
import com.jsast.ast.ReturnStatement;
import com.jsast.ast.SequenceExpression;
import com.jsast.ast.SpreadElement;
import com.jsast.ast.StringLiteral;
import com.jsast.ast.Super;
import com.jsast.ast.SwitchCase;
import com.jsast.ast.SwitchStatement;
import com.jsast.ast.TaggedTemplateExpression;
import com.jsast.ast.TemplateElement;
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
import com.jsast.json.NumberLiterals;
import com.jsast.json.StringEscapes;

import java.io.IOException;
import java.util.List;

/**
 * Writes plain tree nodes in the ESTree shape.
 *
 * <p>Every node is an object whose first field is {@code type}. Absent optional children
 * are written as explicit nulls. Class members are written as {@code MethodDefinition}s
 * and object members as {@code Property} nodes.</p>
 */
public class NodeSerializer extends StdSerializer<Node> {

    private final JavaScriptNumberSerializer numbers = new JavaScriptNumberSerializer();

    public NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider) throws IOException {
        new Writer(gen, provider).node(node);
    }

    /**
     * Holds the generator for one serialization call.
     */
    private final class Writer {

        private final JsonGenerator gen;
        private final SerializerProvider provider;

        Writer(JsonGenerator gen, SerializerProvider provider) {
            this.gen = gen;
            this.provider = provider;
        }

        void node(Node node) throws IOException {
            if (node == null) {
                gen.writeNull();
                return;
            }
            if (node instanceof Literal<?> literal) {
                literal(literal);
                return;
            }
            if (node instanceof Property<?> property) {
                property(property);
                return;
            }
            gen.writeStartObject();
            gen.writeStringField("type", node.type());
            fields(node);
            gen.writeEndObject();
        }

        private void fields(Node node) throws IOException {
            // program level
            if (node instanceof Program<?> n) {
                list("body", n.body());
                gen.writeStringField("sourceType", n.sourceType().text());
            } else if (node instanceof Directive<?> n) {
                field("expression", n.expression());
                gen.writeStringField("directive", n.directive().toString());

            // statements
            } else if (node instanceof ExpressionStatement<?> n) {
                field("expression", n.expression());
            } else if (node instanceof BlockStatement<?> n) {
                list("body", n.body());
            } else if (node instanceof FunctionBody<?> n) {
                list("body", n.body());
            } else if (node instanceof EmptyStatement<?> || node instanceof DebuggerStatement<?>) {
                return;
            } else if (node instanceof WithStatement<?> n) {
                field("object", n.object());
                field("body", n.body());
            } else if (node instanceof ReturnStatement<?> n) {
                field("argument", n.argument());
            } else if (node instanceof LabeledStatement<?> n) {
                field("label", n.label());
                field("body", n.body());
            } else if (node instanceof BreakStatement<?> n) {
                field("label", n.label());
            } else if (node instanceof ContinueStatement<?> n) {
                field("label", n.label());
            } else if (node instanceof IfStatement<?> n) {
                field("test", n.test());
                field("consequent", n.consequent());
                field("alternate", n.alternate());
            } else if (node instanceof SwitchStatement<?> n) {
                field("discriminant", n.discriminant());
                list("cases", n.cases());
            } else if (node instanceof SwitchCase<?> n) {
                field("test", n.test());
                list("consequent", n.consequent());
            } else if (node instanceof ThrowStatement<?> n) {
                field("argument", n.argument());
            } else if (node instanceof TryStatement<?> n) {
                field("block", n.block());
                field("handler", n.handler());
                field("finalizer", n.finalizer());
            } else if (node instanceof CatchClause<?> n) {
                field("param", n.param());
                field("body", n.body());
            } else if (node instanceof WhileStatement<?> n) {
                field("test", n.test());
                field("body", n.body());
            } else if (node instanceof DoWhileStatement<?> n) {
                field("body", n.body());
                field("test", n.test());
            } else if (node instanceof ForStatement<?> n) {
                field("init", n.init());
                field("test", n.test());
                field("update", n.update());
                field("body", n.body());
            } else if (node instanceof ForInStatement<?> n) {
                field("left", n.left());
                field("right", n.right());
                field("body", n.body());
            } else if (node instanceof ForOfStatement<?> n) {
                field("left", n.left());
                field("right", n.right());
                field("body", n.body());
                gen.writeBooleanField("await", n.await());

            // declarations
            } else if (node instanceof VariableDeclaration<?> n) {
                list("declarations", n.declarations());
                gen.writeStringField("kind", n.kind().text());
            } else if (node instanceof VariableDeclarator<?> n) {
                field("id", n.id());
                field("init", n.init());
            } else if (node instanceof FunctionDeclaration<?> n) {
                function(n.id(), n.params(), n.body(), n.generator(), false, n.async());
            } else if (node instanceof FunctionExpression<?> n) {
                function(n.id(), n.params(), n.body(), n.generator(), false, n.async());
            } else if (node instanceof ArrowFunctionExpression<?> n) {
                function(null, n.params(), n.body(), false, n.expression(), n.async());
            } else if (node instanceof ClassDeclaration<?> n) {
                field("id", n.id());
                field("superClass", n.superClass());
                field("body", n.body());
            } else if (node instanceof ClassExpression<?> n) {
                field("id", n.id());
                field("superClass", n.superClass());
                field("body", n.body());
            } else if (node instanceof ClassBody<?> n) {
                gen.writeArrayFieldStart("body");
                for (Property<?> member : n.body()) {
                    methodDefinition(member);
                }
                gen.writeEndArray();

            // modules
            } else if (node instanceof ImportDeclaration<?> n) {
                list("specifiers", n.specifiers());
                field("source", n.source());
            } else if (node instanceof ImportSpecifier<?> n) {
                field("local", n.local() != null ? n.local() : n.imported());
                field("imported", n.imported());
            } else if (node instanceof ImportDefaultSpecifier<?> n) {
                field("local", n.local());
            } else if (node instanceof ImportNamespaceSpecifier<?> n) {
                field("local", n.local());
            } else if (node instanceof ExportNamedDeclaration<?> n) {
                field("declaration", n.declaration());
                list("specifiers", n.specifiers());
                field("source", n.source());
            } else if (node instanceof ExportSpecifier<?> n) {
                field("local", n.local());
                field("exported", n.exported() != null ? n.exported() : n.local());
            } else if (node instanceof ExportDefaultDeclaration<?> n) {
                field("declaration", n.declaration());
            } else if (node instanceof ExportAllDeclaration<?> n) {
                field("source", n.source());
                field("exported", n.exported());

            // expressions
            } else if (node instanceof Identifier<?> n) {
                gen.writeStringField("name", n.name().toString());
            } else if (node instanceof ThisExpression<?> || node instanceof Super<?>) {
                return;
            } else if (node instanceof ArrayExpression<?> n) {
                list("elements", n.elements());
            } else if (node instanceof ObjectExpression<?> n) {
                list("properties", n.properties());
            } else if (node instanceof SpreadElement<?> n) {
                field("argument", n.argument());
            } else if (node instanceof TemplateLiteral<?> n) {
                list("quasis", n.quasis());
                list("expressions", n.expressions());
            } else if (node instanceof TemplateElement<?> n) {
                gen.writeObjectFieldStart("value");
                gen.writeStringField("raw", n.raw().toString());
                gen.writeStringField("cooked", StringEscapes.cook(n.raw()));
                gen.writeEndObject();
                gen.writeBooleanField("tail", n.tail());
            } else if (node instanceof TaggedTemplateExpression<?> n) {
                field("tag", n.tag());
                field("quasi", n.quasi());
            } else if (node instanceof UnaryExpression<?> n) {
                gen.writeStringField("operator", n.operator().text());
                gen.writeBooleanField("prefix", n.prefix());
                field("argument", n.argument());
            } else if (node instanceof UpdateExpression<?> n) {
                gen.writeStringField("operator", n.operator().text());
                field("argument", n.argument());
                gen.writeBooleanField("prefix", n.prefix());
            } else if (node instanceof BinaryExpression<?> n) {
                operation(n.operator().text(), n.left(), n.right());
            } else if (node instanceof LogicalExpression<?> n) {
                operation(n.operator().text(), n.left(), n.right());
            } else if (node instanceof AssignmentExpression<?> n) {
                operation(n.operator().text(), n.left(), n.right());
            } else if (node instanceof MemberExpression<?> n) {
                field("object", n.object());
                field("property", n.property());
                gen.writeBooleanField("computed", n.computed());
            } else if (node instanceof ConditionalExpression<?> n) {
                field("test", n.test());
                field("consequent", n.consequent());
                field("alternate", n.alternate());
            } else if (node instanceof CallExpression<?> n) {
                field("callee", n.callee());
                list("arguments", n.arguments());
            } else if (node instanceof NewExpression<?> n) {
                field("callee", n.callee());
                list("arguments", n.arguments());
            } else if (node instanceof SequenceExpression<?> n) {
                list("expressions", n.expressions());
            } else if (node instanceof YieldExpression<?> n) {
                field("argument", n.argument());
                gen.writeBooleanField("delegate", n.delegate());
            } else if (node instanceof AwaitExpression<?> n) {
                field("argument", n.argument());
            } else if (node instanceof MetaProperty<?> n) {
                field("meta", n.meta());
                field("property", n.property());

            // patterns
            } else if (node instanceof ObjectPattern<?> n) {
                list("properties", n.properties());
            } else if (node instanceof ArrayPattern<?> n) {
                list("elements", n.elements());
            } else if (node instanceof AssignmentPattern<?> n) {
                field("left", n.left());
                field("right", n.right());
            } else if (node instanceof RestElement<?> n) {
                field("argument", n.argument());
            } else {
                throw new IllegalArgumentException("No ESTree shape for " + node.getClass().getName());
            }
        }

        private void function(Node id, List<? extends Node> params, Node body,
                              boolean generator, boolean expression, boolean async) throws IOException {
            field("id", id);
            list("params", params);
            field("body", body);
            gen.writeBooleanField("generator", generator);
            gen.writeBooleanField("expression", expression);
            gen.writeBooleanField("async", async);
        }

        private void operation(String operator, Node left, Node right) throws IOException {
            gen.writeStringField("operator", operator);
            field("left", left);
            field("right", right);
        }

        /**
         * An object literal or object pattern member.
         */
        private void property(Property<?> property) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("type", "Property");
            field("key", property.key());
            gen.writeBooleanField("computed", property.computed());
            field("value", property.value() != null ? property.value() : property.key());
            String kind = property.kind() == PropertyKind.GET || property.kind() == PropertyKind.SET
                ? property.kind().text()
                : PropertyKind.INIT.text();
            gen.writeStringField("kind", kind);
            gen.writeBooleanField("method", property.method());
            gen.writeBooleanField("shorthand", property.shorthand());
            gen.writeEndObject();
        }

        private void methodDefinition(Property<?> member) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("type", "MethodDefinition");
            field("key", member.key());
            gen.writeBooleanField("computed", member.computed());
            field("value", member.value());
            String kind = member.kind() == PropertyKind.INIT ? PropertyKind.METHOD.text() : member.kind().text();
            gen.writeStringField("kind", kind);
            gen.writeBooleanField("static", member.isStatic());
            gen.writeEndObject();
        }

        private void literal(Literal<?> literal) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("type", literal.type());
            if (literal instanceof NullLiteral<?>) {
                gen.writeNullField("value");
                gen.writeStringField("raw", "null");
            } else if (literal instanceof BooleanLiteral<?> b) {
                gen.writeBooleanField("value", b.value());
                gen.writeStringField("raw", String.valueOf(b.value()));
            } else if (literal instanceof NumberLiteral<?> n) {
                gen.writeFieldName("value");
                numbers.serialize(NumberLiterals.valueOf(n.raw()), gen, provider);
                gen.writeStringField("raw", n.raw().toString());
            } else if (literal instanceof StringLiteral<?> s) {
                String quote = s.quote().text();
                gen.writeStringField("value", StringEscapes.cook(s.content()));
                gen.writeStringField("raw", quote + s.content() + quote);
            } else if (literal instanceof RegExpLiteral<?> r) {
                String flags = r.flags() == null ? "" : r.flags().toString();
                // a RegExp object has no JSON form
                gen.writeObjectFieldStart("value");
                gen.writeEndObject();
                gen.writeStringField("raw", "/" + r.pattern() + "/" + flags);
                gen.writeObjectFieldStart("regex");
                gen.writeStringField("pattern", r.pattern().toString());
                gen.writeStringField("flags", flags);
                gen.writeEndObject();
            }
            gen.writeEndObject();
        }

        private void field(String name, Node child) throws IOException {
            gen.writeFieldName(name);
            node(child);
        }

        private void list(String name, List<? extends Node> children) throws IOException {
            gen.writeArrayFieldStart(name);
            for (Node child : children) {
                node(child);
            }
            gen.writeEndArray();
        }
    }
}
