package org.javai.buildscript.language;

/**
 * Anything that may appear as an entry of a {@link Block}.
 */
public sealed interface DataStatement extends LanguageTreeElement
		permits Assignment, ErroneousStatement, Expr, LocalValue {
}
