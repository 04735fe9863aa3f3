package org.javai.buildscript.language;

import java.util.Objects;

/**
 * {@code val name = rhs}. Scoping of the binding is left to the evaluator.
 */
public record LocalValue(String name, Expr rhs, SourceData sourceData) implements DataStatement {

	public LocalValue {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(rhs, "rhs must not be null");
		Objects.requireNonNull(sourceData, "sourceData must not be null");
	}

	@Override
	public <R> R accept(LanguageTreeVisitor<R> visitor) {
		return visitor.visitLocalValue(this);
	}
}
