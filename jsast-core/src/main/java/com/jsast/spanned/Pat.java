package com.jsast.spanned;

/**
 * Binding and destructuring patterns.
 */
public sealed interface Pat<T extends CharSequence>
    extends FuncArg<T>, ArrayPatPart<T>, PropKey<T>, PropValue<T>, AssignTarget<T>, LoopLeft<T>
    permits Ident, ObjPat, ArrayPat, AssignPat {
}
