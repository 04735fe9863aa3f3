package org.javai.buildscript.language;

import java.util.ArrayList;
import java.util.List;

/**
 * Two or more sibling failures of one composite element, in source order.
 * <p>
 * The container is always flat: nested {@code MultipleFailuresResult}s passed in are spliced
 * into their parent, so {@link #failures()} only holds {@link ParsingError}s and
 * {@link UnsupportedConstruct}s.
 */
public record MultipleFailuresResult<T>(List<FailingResult<?>> failures) implements FailingResult<T> {

	public MultipleFailuresResult {
		List<FailingResult<?>> flattened = new ArrayList<>();
		for (FailingResult<?> failure : failures) {
			flattened.addAll(failure.singleFailures());
		}
		if (flattened.size() < 2) {
			throw new IllegalArgumentException("Multiple failures require at least two failures, got " + flattened.size());
		}
		failures = List.copyOf(flattened);
	}

	@Override
	public List<FailingResult<?>> singleFailures() {
		return failures;
	}

	@Override
	public <R> R accept(LanguageResultVisitor<T, R> visitor) {
		return visitor.visitMultipleFailures(this);
	}
}
