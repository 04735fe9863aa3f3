package org.javai.buildscript.language;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Utility class for walking language trees.
 */
public final class LanguageTreeWalker {

	private static final LanguageTreeVisitor<List<LanguageTreeElement>> CHILDREN = new ChildrenVisitor();

	private LanguageTreeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits {@code element} and then its descendants, in source order.
	 * <p>
	 * The failure carried by an {@link ErroneousStatement} is data, not a child element, so
	 * the walk does not descend into it.
	 */
	public static void walkPreOrder(LanguageTreeElement element, Consumer<? super LanguageTreeElement> action) {
		if (element == null) {
			return;
		}
		action.accept(element);
		for (LanguageTreeElement child : children(element)) {
			walkPreOrder(child, action);
		}
	}

	/**
	 * The direct children of {@code element}, in source order.
	 */
	public static List<LanguageTreeElement> children(LanguageTreeElement element) {
		return element.accept(CHILDREN);
	}

	private static final class ChildrenVisitor implements LanguageTreeVisitor<List<LanguageTreeElement>> {

		@Override
		public List<LanguageTreeElement> visitBlock(Block block) {
			return List.copyOf(block.content());
		}

		@Override
		public List<LanguageTreeElement> visitImport(Import anImport) {
			return List.of();
		}

		@Override
		public List<LanguageTreeElement> visitAssignment(Assignment assignment) {
			return List.of(assignment.lhs(), assignment.rhs());
		}

		@Override
		public List<LanguageTreeElement> visitLocalValue(LocalValue localValue) {
			return List.of(localValue.rhs());
		}

		@Override
		public List<LanguageTreeElement> visitErroneousStatement(ErroneousStatement erroneousStatement) {
			return List.of();
		}

		@Override
		public List<LanguageTreeElement> visitFunctionCall(FunctionCall functionCall) {
			List<LanguageTreeElement> children = new ArrayList<>();
			if (functionCall.receiver() != null) {
				children.add(functionCall.receiver());
			}
			children.addAll(functionCall.args());
			return children;
		}

		@Override
		public List<LanguageTreeElement> visitPositionalArgument(FunctionArgument.Positional argument) {
			return List.of(argument.expr());
		}

		@Override
		public List<LanguageTreeElement> visitNamedArgument(FunctionArgument.Named argument) {
			return List.of(argument.expr());
		}

		@Override
		public List<LanguageTreeElement> visitLambdaArgument(FunctionArgument.Lambda argument) {
			return List.of(argument.block());
		}

		@Override
		public List<LanguageTreeElement> visitPropertyAccess(PropertyAccess propertyAccess) {
			return propertyAccess.hasReceiver() ? List.of(propertyAccess.receiver()) : List.of();
		}

		@Override
		public List<LanguageTreeElement> visitBooleanLiteral(Literal.BooleanLiteral literal) {
			return List.of();
		}

		@Override
		public List<LanguageTreeElement> visitIntLiteral(Literal.IntLiteral literal) {
			return List.of();
		}

		@Override
		public List<LanguageTreeElement> visitLongLiteral(Literal.LongLiteral literal) {
			return List.of();
		}

		@Override
		public List<LanguageTreeElement> visitStringLiteral(Literal.StringLiteral literal) {
			return List.of();
		}

		@Override
		public List<LanguageTreeElement> visitNull(Null nullLiteral) {
			return List.of();
		}

		@Override
		public List<LanguageTreeElement> visitThis(This thisReference) {
			return List.of();
		}
	}
}
