package org.javai.buildscript.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.javai.buildscript.language.Element;
import org.javai.buildscript.language.FailingResult;
import org.javai.buildscript.language.LanguageResult;
import org.javai.buildscript.language.MultipleFailuresResult;

/**
 * Gathers the failures of the children of one composite element, in the order the children are
 * built, and decides the element's result once all children are done.
 */
final class FailureCollector {

	private final List<FailingResult<?>> failures = new ArrayList<>();

	/**
	 * @return the element of a successful result, {@code null} after recording a failure
	 */
	<T> T collect(LanguageResult<T> result) {
		if (result instanceof FailingResult<T> failure) {
			failures.add(failure);
			return null;
		}
		return ((Element<T>) result).element();
	}

	void add(FailingResult<?> failure) {
		failures.add(failure);
	}

	/**
	 * The collected failures as one result, for elements that cannot be built once anything was
	 * collected.
	 */
	<T> FailingResult<T> failure() {
		if (failures.isEmpty()) {
			throw new IllegalStateException("No failure was collected");
		}
		if (failures.size() == 1) {
			return failures.get(0).propagate();
		}
		return new MultipleFailuresResult<>(failures);
	}

	/**
	 * The element built by {@code element} if no failure was collected; otherwise the single
	 * failure, or all of them as one {@link MultipleFailuresResult}.
	 */
	<T> LanguageResult<T> elementIfNoFailures(Supplier<? extends T> element) {
		if (failures.isEmpty()) {
			return new Element<>(element.get());
		}
		return failure();
	}
}
