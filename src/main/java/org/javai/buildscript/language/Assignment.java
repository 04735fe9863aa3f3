package org.javai.buildscript.language;

import java.util.Objects;

/**
 * {@code lhs = rhs}, where the target is always an addressable property.
 */
public record Assignment(PropertyAccess lhs, Expr rhs, SourceData sourceData) implements DataStatement {

	public Assignment {
		Objects.requireNonNull(lhs, "lhs must not be null");
		Objects.requireNonNull(rhs, "rhs must not be null");
		Objects.requireNonNull(sourceData, "sourceData must not be null");
	}

	@Override
	public <R> R accept(LanguageTreeVisitor<R> visitor) {
		return visitor.visitAssignment(this);
	}
}
