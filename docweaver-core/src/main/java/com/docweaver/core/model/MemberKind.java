package com.docweaver.core.model;

/**
 * Kind of a type member.
 */
public enum MemberKind {
    CONSTRUCTOR,
    FIELD,
    PROPERTY,
    METHOD,
    EVENT,
    OPERATOR
}
