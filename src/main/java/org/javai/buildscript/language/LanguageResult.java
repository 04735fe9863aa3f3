package org.javai.buildscript.language;

import java.util.function.Function;

/**
 * The outcome of building one language tree element: either the element, or a failure
 * describing why the syntax at that position could not become one.
 * <p>
 * Failures are plain data. They never interrupt the traversal of sibling nodes and callers
 * decide whether to abort, warn or continue by inspecting them.
 *
 * @param <T> the type of element that was being built
 */
public sealed interface LanguageResult<T> permits Element, FailingResult {

	<R> R accept(LanguageResultVisitor<T, R> visitor);

	/**
	 * Transforms a successful element, passing failures through unchanged.
	 */
	<R> LanguageResult<R> map(Function<? super T, ? extends R> mapper);
}
