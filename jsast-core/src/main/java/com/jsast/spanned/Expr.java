package com.jsast.spanned;

public sealed interface Expr<T extends CharSequence>
    extends FuncArg<T>, ArrayPatPart<T>, PropKey<T>, PropValue<T>, AssignTarget<T>,
            LoopLeft<T>, LoopInit<T>, ArrowFuncBody<T>
    permits ArrayExpr, ArrowFuncExpr, ArrowParamPlaceholder, AssignExpr, AwaitExpr, BinaryExpr,
            CallExpr, ClassDef, ConditionalExpr, Func, Ident, Lit, LogicalExpr, MemberExpr, MetaProp,
            NewExpr, ObjExpr, SequenceExpr, SpreadExpr, Expr.Super, Expr.This, TaggedTemplateExpr,
            UnaryExpr, UpdateExpr, WrappedExpr, YieldExpr {

    record This<T extends CharSequence>(Token keyword) implements Expr<T> {
    }

    record Super<T extends CharSequence>(Token keyword) implements Expr<T> {
    }
}
