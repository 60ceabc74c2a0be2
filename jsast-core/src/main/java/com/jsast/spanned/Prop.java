package com.jsast.spanned;

/**
 * A member of an object literal, object pattern or class body.
 */
public sealed interface Prop<T extends CharSequence> extends ObjProp<T>, ObjPatPart<T>
    permits PropInit, PropMethod, PropCtor, PropGet, PropSet {
}
