package org.javai.buildscript.diagnostics;

import java.util.Objects;
import org.javai.buildscript.language.SourceData;
import org.javai.buildscript.language.UnsupportedLanguageFeature;

/**
 * One problem found while building a language tree, ready to be shown to a script author.
 *
 * @param kind whether the input was malformed or used an unsupported feature
 * @param message what is wrong
 * @param feature the unsupported feature, {@code null} for parsing errors
 * @param hint how to fix it, if known
 * @param potentialElementSource the extent of the element that failed to build
 * @param erroneousSource the extent to highlight
 */
public record Diagnostic(
		Kind kind,
		String message,
		UnsupportedLanguageFeature feature,
		String hint,
		SourceData potentialElementSource,
		SourceData erroneousSource
) {

	public enum Kind {
		PARSING_ERROR,
		UNSUPPORTED_CONSTRUCT
	}

	public Diagnostic {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(message, "message must not be null");
		Objects.requireNonNull(potentialElementSource, "potentialElementSource must not be null");
		Objects.requireNonNull(erroneousSource, "erroneousSource must not be null");
	}
}
