package com.jsast.spanned;

public record RestPat<T extends CharSequence>(Token ellipsis, Pat<T> pat)
    implements FuncArg<T>, ArrayPatPart<T>, ObjPatPart<T> {
}
