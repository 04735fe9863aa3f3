package org.javai.buildscript.language;

/**
 * A value-producing element. Every expression may also stand alone as a statement.
 */
public sealed interface Expr extends DataStatement permits FunctionCall, Literal, Null, PropertyAccess, This {
}
