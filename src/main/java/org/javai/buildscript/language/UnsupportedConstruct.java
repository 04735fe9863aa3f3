package org.javai.buildscript.language;

import java.util.List;
import java.util.Objects;

/**
 * Well-formed syntax that lies outside of the supported language subset.
 *
 * @param languageFeature which unsupported feature was used, for feature-specific guidance
 * @param potentialElementSource the broadest extent that could have been a valid element
 * @param erroneousSource the minimal extent that uses the feature
 */
public record UnsupportedConstruct<T>(
		UnsupportedLanguageFeature languageFeature,
		SourceData potentialElementSource,
		SourceData erroneousSource
) implements FailingResult<T> {

	public UnsupportedConstruct {
		Objects.requireNonNull(languageFeature, "languageFeature must not be null");
		Objects.requireNonNull(potentialElementSource, "potentialElementSource must not be null");
		Objects.requireNonNull(erroneousSource, "erroneousSource must not be null");
	}

	@Override
	public List<FailingResult<?>> singleFailures() {
		return List.of(this);
	}

	@Override
	public <R> R accept(LanguageResultVisitor<T, R> visitor) {
		return visitor.visitUnsupportedConstruct(this);
	}
}
