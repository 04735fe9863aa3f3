package org.javai.buildscript.language;

import java.util.List;
import java.util.function.Function;

/**
 * A result that carries no element. Failures hold no value of their type parameter, so a
 * failure raised while building one kind of element can be propagated as the result of its
 * parent without being copied.
 */
public sealed interface FailingResult<T> extends LanguageResult<T>
		permits MultipleFailuresResult, ParsingError, UnsupportedConstruct {

	/**
	 * This failure, re-typed as the result of an enclosing element.
	 */
	@SuppressWarnings("unchecked")
	default <R> FailingResult<R> propagate() {
		return (FailingResult<R>) (FailingResult<?>) this;
	}

	@Override
	default <R> LanguageResult<R> map(Function<? super T, ? extends R> mapper) {
		return propagate();
	}

	/**
	 * The individual failures, in source order. A single failure returns itself.
	 */
	List<FailingResult<?>> singleFailures();
}
