package com.docweaver.core.model;

/**
 * Kind of a documented type.
 */
public enum TypeKind {
    CLASS,
    STRUCT,
    INTERFACE,
    ENUM,
    DELEGATE,
    RECORD
}
