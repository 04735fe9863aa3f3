package org.javai.buildscript.language;

import java.util.Objects;

/**
 * An argument of a {@link FunctionCall}. Sealed to the three argument forms the language
 * supports.
 */
public sealed interface FunctionArgument extends LanguageTreeElement {

	/**
	 * {@code f(expr)}
	 */
	record Positional(Expr expr, SourceData sourceData) implements FunctionArgument {

		public Positional {
			Objects.requireNonNull(expr, "expr must not be null");
			Objects.requireNonNull(sourceData, "sourceData must not be null");
		}

		@Override
		public <R> R accept(LanguageTreeVisitor<R> visitor) {
			return visitor.visitPositionalArgument(this);
		}
	}

	/**
	 * {@code f(name = expr)}
	 */
	record Named(String name, Expr expr, SourceData sourceData) implements FunctionArgument {

		public Named {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(expr, "expr must not be null");
			Objects.requireNonNull(sourceData, "sourceData must not be null");
		}

		@Override
		public <R> R accept(LanguageTreeVisitor<R> visitor) {
			return visitor.visitNamedArgument(this);
		}
	}

	/**
	 * {@code f { ... }}: the trailing block of a call. The span covers the braces, the block
	 * covers what is between them.
	 */
	record Lambda(Block block, SourceData sourceData) implements FunctionArgument {

		public Lambda {
			Objects.requireNonNull(block, "block must not be null");
			Objects.requireNonNull(sourceData, "sourceData must not be null");
		}

		@Override
		public <R> R accept(LanguageTreeVisitor<R> visitor) {
			return visitor.visitLambdaArgument(this);
		}
	}
}
