package com.jsast.ast;

public sealed interface Expression<T extends CharSequence> extends DefaultExportable<T>, FunctionParameter<T>, ArrayPatternElement<T>, PropertyKey<T>, PropertyValue<T>,
            AssignmentTarget<T>, ForInit<T>, ForLeft<T>, ArrowBody<T>
    permits ThisExpression, Super, ArrayExpression, ObjectExpression, FunctionExpression, ArrowFunctionExpression,
            ClassExpression, TaggedTemplateExpression, TemplateLiteral, UnaryExpression, UpdateExpression,
            BinaryExpression, AssignmentExpression, LogicalExpression, MemberExpression, ConditionalExpression,
            CallExpression, NewExpression, SequenceExpression, YieldExpression, AwaitExpression, MetaProperty,
            Identifier, Literal, SpreadElement {
}
