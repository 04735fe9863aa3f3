package org.javai.buildscript.language;

import java.util.Objects;
import java.util.function.Function;

/**
 * A successfully built element.
 */
public record Element<T>(T element) implements LanguageResult<T> {

	public Element {
		Objects.requireNonNull(element, "element must not be null");
	}

	@Override
	public <R> R accept(LanguageResultVisitor<T, R> visitor) {
		return visitor.visitElement(this);
	}

	@Override
	public <R> LanguageResult<R> map(Function<? super T, ? extends R> mapper) {
		return new Element<>(mapper.apply(element));
	}
}
