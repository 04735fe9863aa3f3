package org.javai.buildscript.language;

import java.util.Objects;

/**
 * A reference to {@code name}, either unqualified or on an explicit {@code receiver}.
 */
public record PropertyAccess(Expr receiver, String name, SourceData sourceData) implements Expr {

	public PropertyAccess {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(sourceData, "sourceData must not be null");
	}

	public boolean hasReceiver() {
		return receiver != null;
	}

	@Override
	public <R> R accept(LanguageTreeVisitor<R> visitor) {
		return visitor.visitPropertyAccess(this);
	}
}
