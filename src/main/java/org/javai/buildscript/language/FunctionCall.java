package org.javai.buildscript.language;

import java.util.List;
import java.util.Objects;

/**
 * A call of {@code name} with its arguments in source order. A trailing lambda is the last
 * argument.
 *
 * @param receiver the explicit receiver, or {@code null} for an unqualified call
 * @param name the called function
 * @param args positional, named and lambda arguments in source order
 * @param sourceData the extent of the call including its receiver
 */
public record FunctionCall(Expr receiver, String name, List<FunctionArgument> args, SourceData sourceData)
		implements Expr {

	public FunctionCall {
		Objects.requireNonNull(name, "name must not be null");
		args = List.copyOf(args);
		Objects.requireNonNull(sourceData, "sourceData must not be null");
	}

	public boolean hasReceiver() {
		return receiver != null;
	}

	@Override
	public <R> R accept(LanguageTreeVisitor<R> visitor) {
		return visitor.visitFunctionCall(this);
	}
}
