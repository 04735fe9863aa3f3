package org.javai.buildscript.language;

import java.util.List;
import java.util.Objects;

/**
 * Input that is malformed with respect to the grammar, or whose content is invalid although its
 * shape is recognized (an out-of-range number, an illegal escape).
 *
 * @param message what is wrong
 * @param potentialElementSource the broadest extent that could have been a valid element
 * @param erroneousSource the minimal extent implicated in the failure
 */
public record ParsingError<T>(String message, SourceData potentialElementSource, SourceData erroneousSource)
		implements FailingResult<T> {

	public ParsingError {
		Objects.requireNonNull(message, "message must not be null");
		Objects.requireNonNull(potentialElementSource, "potentialElementSource must not be null");
		Objects.requireNonNull(erroneousSource, "erroneousSource must not be null");
	}

	@Override
	public List<FailingResult<?>> singleFailures() {
		return List.of(this);
	}

	@Override
	public <R> R accept(LanguageResultVisitor<T, R> visitor) {
		return visitor.visitParsingError(this);
	}
}
