package org.javai.buildscript.language;

import java.util.List;
import java.util.Objects;

/**
 * {@code import a.b.C}, kept as its dot-separated name parts.
 */
public record Import(List<String> nameParts, SourceData sourceData) implements LanguageTreeElement {

	public Import {
		nameParts = List.copyOf(nameParts);
		Objects.requireNonNull(sourceData, "sourceData must not be null");
	}

	public String qualifiedName() {
		return String.join(".", nameParts);
	}

	@Override
	public <R> R accept(LanguageTreeVisitor<R> visitor) {
		return visitor.visitImport(this);
	}
}
