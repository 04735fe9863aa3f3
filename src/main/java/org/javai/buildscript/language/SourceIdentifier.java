package org.javai.buildscript.language;

import java.util.Objects;

/**
 * Names the source unit (a script file or a named fragment) that a tree was built from.
 *
 * @param fileIdentifier the name used in diagnostics, e.g. a path or {@code "settings"}
 */
public record SourceIdentifier(String fileIdentifier) {

	public SourceIdentifier {
		Objects.requireNonNull(fileIdentifier, "fileIdentifier must not be null");
	}

	@Override
	public String toString() {
		return fileIdentifier;
	}
}
