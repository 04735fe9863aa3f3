package org.javai.buildscript.language;

import java.util.Objects;

public record This(SourceData sourceData) implements Expr {

	public This {
		Objects.requireNonNull(sourceData, "sourceData must not be null");
	}

	@Override
	public <R> R accept(LanguageTreeVisitor<R> visitor) {
		return visitor.visitThis(this);
	}
}
