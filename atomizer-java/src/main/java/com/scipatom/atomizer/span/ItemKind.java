package com.scipatom.atomizer.span;

public enum ItemKind {
    FUNCTION,
    IMPL,
    TRAIT,
    MODULE,
    EXTERN_BLOCK,
    MACRO
}
