package org.javai.buildscript.language;

import java.util.Objects;

public record Null(SourceData sourceData) implements Expr {

	public Null {
		Objects.requireNonNull(sourceData, "sourceData must not be null");
	}

	@Override
	public <R> R accept(LanguageTreeVisitor<R> visitor) {
		return visitor.visitNull(this);
	}
}
