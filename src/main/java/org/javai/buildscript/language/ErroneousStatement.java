package org.javai.buildscript.language;

import java.util.Objects;

/**
 * A statement position whose content failed to build. The failure is kept as data so the
 * enclosing block stays structurally complete.
 */
public record ErroneousStatement(FailingResult<?> failingResult, SourceData sourceData) implements DataStatement {

	public ErroneousStatement {
		Objects.requireNonNull(failingResult, "failingResult must not be null");
		Objects.requireNonNull(sourceData, "sourceData must not be null");
	}

	@Override
	public <R> R accept(LanguageTreeVisitor<R> visitor) {
		return visitor.visitErroneousStatement(this);
	}
}
