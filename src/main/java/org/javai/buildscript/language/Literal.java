package org.javai.buildscript.language;

import java.util.Objects;

/**
 * A constant of one of the supported types.
 *
 * @param <T> the boxed type of the value
 */
public sealed interface Literal<T> extends Expr {

	T value();

	record BooleanLiteral(Boolean value, SourceData sourceData) implements Literal<Boolean> {

		public BooleanLiteral {
			Objects.requireNonNull(value, "value must not be null");
			Objects.requireNonNull(sourceData, "sourceData must not be null");
		}

		@Override
		public <R> R accept(LanguageTreeVisitor<R> visitor) {
			return visitor.visitBooleanLiteral(this);
		}
	}

	record IntLiteral(Integer value, SourceData sourceData) implements Literal<Integer> {

		public IntLiteral {
			Objects.requireNonNull(value, "value must not be null");
			Objects.requireNonNull(sourceData, "sourceData must not be null");
		}

		@Override
		public <R> R accept(LanguageTreeVisitor<R> visitor) {
			return visitor.visitIntLiteral(this);
		}
	}

	record LongLiteral(Long value, SourceData sourceData) implements Literal<Long> {

		public LongLiteral {
			Objects.requireNonNull(value, "value must not be null");
			Objects.requireNonNull(sourceData, "sourceData must not be null");
		}

		@Override
		public <R> R accept(LanguageTreeVisitor<R> visitor) {
			return visitor.visitLongLiteral(this);
		}
	}

	/**
	 * A string with its escapes already decoded.
	 */
	record StringLiteral(String value, SourceData sourceData) implements Literal<String> {

		public StringLiteral {
			Objects.requireNonNull(value, "value must not be null");
			Objects.requireNonNull(sourceData, "sourceData must not be null");
		}

		@Override
		public <R> R accept(LanguageTreeVisitor<R> visitor) {
			return visitor.visitStringLiteral(this);
		}
	}
}
