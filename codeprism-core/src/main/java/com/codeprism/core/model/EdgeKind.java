package com.codeprism.core.model;

/**
 * Why one entity depends on another.
 */
public enum EdgeKind {
    /** Class owns the method */
    CONTAINS,
    /** Method belongs to the class */
    MEMBER_OF,
    /** Source body names the target */
    REFERENCES
}
