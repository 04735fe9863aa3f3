package org.javai.buildscript.language;

/**
 * Visitor over every {@link LanguageTreeElement} variant.
 * <p>
 * Operations such as printing, diagnostics collection or evaluation implement this interface;
 * a new node kind adds a method here and thereby breaks every implementation that does not
 * handle it yet.
 *
 * @param <R> the result type of the visit
 */
public interface LanguageTreeVisitor<R> {

	R visitBlock(Block block);

	R visitImport(Import importElement);

	R visitAssignment(Assignment assignment);

	R visitLocalValue(LocalValue localValue);

	R visitErroneousStatement(ErroneousStatement erroneousStatement);

	R visitFunctionCall(FunctionCall functionCall);

	R visitPositionalArgument(FunctionArgument.Positional argument);

	R visitNamedArgument(FunctionArgument.Named argument);

	R visitLambdaArgument(FunctionArgument.Lambda argument);

	R visitPropertyAccess(PropertyAccess propertyAccess);

	R visitBooleanLiteral(Literal.BooleanLiteral literal);

	R visitIntLiteral(Literal.IntLiteral literal);

	R visitLongLiteral(Literal.LongLiteral literal);

	R visitStringLiteral(Literal.StringLiteral literal);

	R visitNull(Null nullElement);

	R visitThis(This thisElement);
}
