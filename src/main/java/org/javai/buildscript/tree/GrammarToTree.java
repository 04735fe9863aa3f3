package org.javai.buildscript.tree;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.javai.buildscript.language.Assignment;
import org.javai.buildscript.language.Block;
import org.javai.buildscript.language.DataStatement;
import org.javai.buildscript.language.Element;
import org.javai.buildscript.language.ErroneousStatement;
import org.javai.buildscript.language.Expr;
import org.javai.buildscript.language.FailingResult;
import org.javai.buildscript.language.FunctionArgument;
import org.javai.buildscript.language.FunctionCall;
import org.javai.buildscript.language.Import;
import org.javai.buildscript.language.LanguageResult;
import org.javai.buildscript.language.LanguageTreeResult;
import org.javai.buildscript.language.Literal;
import org.javai.buildscript.language.LocalValue;
import org.javai.buildscript.language.Null;
import org.javai.buildscript.language.ParsingError;
import org.javai.buildscript.language.PropertyAccess;
import org.javai.buildscript.language.SourceData;
import org.javai.buildscript.language.SourceText;
import org.javai.buildscript.language.This;
import org.javai.buildscript.language.UnsupportedConstruct;
import org.javai.buildscript.language.UnsupportedLanguageFeature;
import org.javai.buildscript.syntax.SyntaxKind;

/**
 * Transforms the concrete syntax of one source unit into its language tree.
 * <p>
 * Classification is driven by the shape of each node. Every composite node builds all of its
 * children before deciding its own result, so one bad child never hides the failures of its
 * siblings. Recursion follows the nesting of the source.
 */
final class GrammarToTree {

	static final String OUT_OF_RANGE = "The value is out of range";

	// the parser's message for a missing initializer
	private static final String EXPECTING_EXPRESSION = "Expecting an expression";

	private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of("+=", "-=", "*=", "/=", "%=");

	private final SourceText source;

	GrammarToTree(SourceText source) {
		this.source = source;
	}

	LanguageTreeResult build(SyntaxElement root) {
		if (root.kind() != SyntaxKind.FILE) {
			SourceData rootSpan = span(root);
			return new LanguageTreeResult(List.of(),
					new ParsingError<>("Expecting a script file, got " + root.kind(), rootSpan, rootSpan));
		}

		List<LanguageResult<Import>> header = new ArrayList<>();
		LanguageResult<Block> topLevelBlock = null;
		for (SyntaxElement child : root.children()) {
			switch (child.kind()) {
				case PACKAGE_DIRECTIVE -> header.add(packageDirective(child));
				case IMPORT_LIST -> child.children().forEach(directive -> header.add(importDirective(directive)));
				case BLOCK -> topLevelBlock = new Element<>(block(child));
				default -> header.add(parsingError(child, child));
			}
		}
		if (topLevelBlock == null) {
			SourceData end = source.span(source.length(), source.length());
			topLevelBlock = new ParsingError<>("Expecting a script body", span(root), end);
		}
		return new LanguageTreeResult(header, topLevelBlock);
	}

	// header

	private LanguageResult<Import> packageDirective(SyntaxElement directive) {
		FailureCollector failures = new FailureCollector();
		collectErrors(directive, failures);
		failures.add(unsupported(UnsupportedLanguageFeature.PACKAGE_HEADER, directive, directive));
		return failures.failure();
	}

	private LanguageResult<Import> importDirective(SyntaxElement directive) {
		if (directive.isError()) {
			return parsingError(directive, directive);
		}
		FailureCollector failures = new FailureCollector();
		List<String> nameParts = new ArrayList<>();
		for (SyntaxElement child : directive.children()) {
			switch (child.kind()) {
				case IDENTIFIER -> nameParts.add(child.text());
				case IMPORT_STAR -> failures.add(unsupported(UnsupportedLanguageFeature.STAR_IMPORT, directive, child));
				case IMPORT_ALIAS -> failures.add(unsupported(UnsupportedLanguageFeature.IMPORT_ALIAS, directive, child));
				default -> failures.add(parsingError(directive, child));
			}
		}
		return failures.elementIfNoFailures(() -> new Import(nameParts, span(directive)));
	}

	// statements

	Block block(SyntaxElement block) {
		List<DataStatement> content = new ArrayList<>();
		for (SyntaxElement statement : block.children()) {
			LanguageResult<DataStatement> result = statement(statement);
			if (result instanceof FailingResult<DataStatement> failure) {
				content.add(new ErroneousStatement(failure, span(statement)));
			} else {
				content.add(((Element<DataStatement>) result).element());
			}
		}
		return new Block(content, span(block));
	}

	private LanguageResult<DataStatement> statement(SyntaxElement statement) {
		if (statement.kind() == SyntaxKind.PROPERTY) {
			return localValue(statement);
		}
		if (statement.kind() == SyntaxKind.BINARY_EXPRESSION) {
			SyntaxElement operation = statement.children().get(1);
			if ("=".equals(operation.text())) {
				return assignment(statement);
			}
			if (AUGMENTED_ASSIGNMENTS.contains(operation.text())) {
				return unsupported(UnsupportedLanguageFeature.AUGMENTED_ASSIGNMENT, statement, operation);
			}
		}
		return expression(statement).map(expr -> expr);
	}

	private LanguageResult<DataStatement> assignment(SyntaxElement assignment) {
		List<SyntaxElement> children = assignment.children();
		SyntaxElement target = children.get(0);
		FailureCollector failures = new FailureCollector();

		Expr lhs = failures.collect(expression(target));
		if (lhs != null && !(lhs instanceof PropertyAccess)) {
			failures.add(new ParsingError<>("Only properties can be assigned", span(assignment), span(target)));
		}
		Expr rhs = failures.collect(expression(children.get(2)));

		return failures.elementIfNoFailures(() -> new Assignment((PropertyAccess) lhs, rhs, span(assignment)));
	}

	private LanguageResult<DataStatement> localValue(SyntaxElement property) {
		FailureCollector failures = new FailureCollector();
		String name = null;
		Expr rhs = null;
		boolean initialized = false;

		for (SyntaxElement child : property.children()) {
			switch (child.kind()) {
				case VAL_KEYWORD -> {
				}
				case VAR_KEYWORD -> failures.add(unsupported(UnsupportedLanguageFeature.LOCAL_VARIABLE, property, child));
				case IDENTIFIER -> name = child.text();
				case TYPE_REFERENCE -> failures.add(unsupported(UnsupportedLanguageFeature.EXPLICIT_TYPE, property, child));
				case ERROR_ELEMENT -> {
					initialized |= EXPECTING_EXPRESSION.equals(child.errorMessage());
					failures.add(parsingError(property, child));
				}
				default -> {
					initialized = true;
					rhs = failures.collect(expression(child));
				}
			}
		}
		if (name != null && !initialized) {
			failures.add(unsupported(UnsupportedLanguageFeature.UNINITIALIZED_VALUE, property, property));
		}

		String valueName = name;
		Expr value = rhs;
		return failures.elementIfNoFailures(() -> new LocalValue(valueName, value, span(property)));
	}

	// expressions

	private LanguageResult<Expr> expression(SyntaxElement expression) {
		return switch (expression.kind()) {
			case REFERENCE_EXPRESSION -> new Element<>(new PropertyAccess(null, expression.text(), span(expression)));
			case CALL_EXPRESSION -> call(expression, null, expression);
			case DOT_QUALIFIED_EXPRESSION -> qualified(expression);
			case SAFE_ACCESS_EXPRESSION -> unsupported(UnsupportedLanguageFeature.SAFE_NAVIGATION, expression, expression);
			case ARRAY_ACCESS_EXPRESSION ->
					unsupported(UnsupportedLanguageFeature.INDEXING, expression, expression.children().get(1));
			case BINARY_EXPRESSION ->
					unsupported(UnsupportedLanguageFeature.BINARY_OPERATOR, expression, expression.children().get(1));
			case PREFIX_EXPRESSION -> prefix(expression);
			case PARENTHESIZED -> parenthesized(expression);
			case IF_EXPRESSION -> unsupported(UnsupportedLanguageFeature.CONTROL_FLOW, expression, expression);
			case THIS_EXPRESSION -> thisExpression(expression);
			case INTEGER_CONSTANT -> integer(expression, expression, false);
			case FLOAT_CONSTANT ->
					unsupported(UnsupportedLanguageFeature.FLOATING_POINT_LITERAL, expression, expression);
			case BOOLEAN_CONSTANT ->
					new Element<>(new Literal.BooleanLiteral(Boolean.parseBoolean(expression.text()), span(expression)));
			case NULL -> new Element<>(new Null(span(expression)));
			case STRING_TEMPLATE -> string(expression);
			case LAMBDA_EXPRESSION -> unsupported(UnsupportedLanguageFeature.DETACHED_LAMBDA, expression, expression);
			case ERROR_ELEMENT -> parsingError(expression, expression);
			case FILE, PACKAGE_DIRECTIVE, IMPORT_LIST, IMPORT_DIRECTIVE, IMPORT_STAR, IMPORT_ALIAS, BLOCK, PROPERTY,
					VAL_KEYWORD, VAR_KEYWORD, TYPE_REFERENCE, IDENTIFIER, VALUE_ARGUMENT_LIST, VALUE_ARGUMENT,
					VALUE_ARGUMENT_NAME, LAMBDA_ARGUMENT, LAMBDA_PARAMETERS, OPERATION_REFERENCE, INDICES, LABEL ->
					new ParsingError<>("Expecting an expression, got " + expression.kind(),
							span(expression), span(expression));
		};
	}

	private LanguageResult<Expr> qualified(SyntaxElement qualified) {
		List<SyntaxElement> children = qualified.children();
		SyntaxElement receiver = children.get(0);
		SyntaxElement selector = children.get(1);

		return switch (selector.kind()) {
			case REFERENCE_EXPRESSION -> {
				FailureCollector failures = new FailureCollector();
				Expr receiverExpr = failures.collect(expression(receiver));
				yield failures.elementIfNoFailures(
						() -> new PropertyAccess(receiverExpr, selector.text(), span(qualified)));
			}
			case CALL_EXPRESSION -> call(selector, receiver, qualified);
			default -> {
				FailureCollector failures = new FailureCollector();
				failures.collect(expression(receiver));
				failures.add(selector.isError()
						? parsingError(qualified, selector)
						: new ParsingError<>("Expecting a name", span(qualified), span(selector)));
				yield failures.failure();
			}
		};
	}

	/**
	 * @param call the call node: a name, optional value arguments and an optional lambda
	 * @param receiver the receiver node of a qualified call, or {@code null}
	 * @param whole the node that spans the whole call including its receiver
	 */
	private LanguageResult<Expr> call(SyntaxElement call, SyntaxElement receiver, SyntaxElement whole) {
		FailureCollector failures = new FailureCollector();
		Expr receiverExpr = receiver != null ? failures.collect(expression(receiver)) : null;

		String name = null;
		List<FunctionArgument> args = new ArrayList<>();
		for (SyntaxElement child : call.children()) {
			switch (child.kind()) {
				case REFERENCE_EXPRESSION -> name = child.text();
				case VALUE_ARGUMENT_LIST -> {
					for (SyntaxElement argument : child.children()) {
						if (argument.isError()) {
							failures.add(parsingError(whole, argument));
							continue;
						}
						FunctionArgument arg = failures.collect(valueArgument(argument));
						if (arg != null) {
							args.add(arg);
						}
					}
				}
				case LAMBDA_ARGUMENT -> {
					FunctionArgument lambda = failures.collect(lambdaArgument(child));
					if (lambda != null) {
						args.add(lambda);
					}
				}
				default -> failures.add(parsingError(whole, child));
			}
		}

		String functionName = name;
		return failures.elementIfNoFailures(() -> new FunctionCall(receiverExpr, functionName, args, span(whole)));
	}

	private LanguageResult<FunctionArgument> valueArgument(SyntaxElement argument) {
		List<SyntaxElement> children = argument.children();
		if (children.size() == 2 && children.get(0).kind() == SyntaxKind.VALUE_ARGUMENT_NAME) {
			String name = children.get(0).text();
			return expression(children.get(1)).map(expr -> new FunctionArgument.Named(name, expr, span(argument)));
		}
		return expression(children.get(0)).map(expr -> new FunctionArgument.Positional(expr, span(argument)));
	}

	private LanguageResult<FunctionArgument> lambdaArgument(SyntaxElement argument) {
		SyntaxElement lambda = argument.children().get(0);
		FailureCollector failures = new FailureCollector();
		Block body = null;

		for (SyntaxElement child : lambda.children()) {
			switch (child.kind()) {
				case LAMBDA_PARAMETERS ->
						failures.add(unsupported(UnsupportedLanguageFeature.LAMBDA_WITH_PARAMETERS, argument, child));
				case BLOCK -> body = block(child);
				default -> failures.add(parsingError(argument, child));
			}
		}

		Block block = body;
		return failures.elementIfNoFailures(() -> new FunctionArgument.Lambda(block, span(argument)));
	}

	private LanguageResult<Expr> prefix(SyntaxElement prefix) {
		SyntaxElement operation = prefix.children().get(0);
		SyntaxElement operand = prefix.children().get(1);
		if ("-".equals(operation.text()) && operand.kind() == SyntaxKind.INTEGER_CONSTANT) {
			return integer(prefix, operand, true);
		}
		return unsupported(UnsupportedLanguageFeature.PREFIX_OPERATOR, prefix, operation);
	}

	private LanguageResult<Expr> parenthesized(SyntaxElement parenthesized) {
		List<SyntaxElement> children = parenthesized.children();
		if (children.size() == 1) {
			return expression(children.get(0));
		}
		FailureCollector failures = new FailureCollector();
		Expr inner = failures.collect(expression(children.get(0)));
		for (SyntaxElement error : children.subList(1, children.size())) {
			failures.add(parsingError(parenthesized, error));
		}
		return failures.elementIfNoFailures(() -> inner);
	}

	private LanguageResult<Expr> thisExpression(SyntaxElement expression) {
		if (expression.children().isEmpty()) {
			return new Element<>(new This(span(expression)));
		}
		SyntaxElement label = expression.children().get(0);
		if (label.isError()) {
			return parsingError(expression, label);
		}
		return unsupported(UnsupportedLanguageFeature.THIS_WITH_LABEL, expression, label);
	}

	// literals

	/**
	 * @param literal the node spanning the literal, including a folded minus sign
	 * @param constant the integer constant itself
	 */
	private LanguageResult<Expr> integer(SyntaxElement literal, SyntaxElement constant, boolean negative) {
		String text = constant.text().replace("_", "");
		boolean longSuffix = text.endsWith("L") || text.endsWith("l");
		if (longSuffix) {
			text = text.substring(0, text.length() - 1);
		}
		int radix = 10;
		if (text.startsWith("0x") || text.startsWith("0X")) {
			radix = 16;
			text = text.substring(2);
		} else if (text.startsWith("0b") || text.startsWith("0B")) {
			radix = 2;
			text = text.substring(2);
		}

		BigInteger value;
		try {
			value = new BigInteger(text, radix);
		} catch (NumberFormatException e) {
			return new ParsingError<>("Malformed integer literal", span(literal), span(constant));
		}
		if (negative) {
			value = value.negate();
		}

		if (!longSuffix && value.bitLength() < Integer.SIZE) {
			return new Element<>(new Literal.IntLiteral(value.intValue(), span(literal)));
		}
		if (value.bitLength() < Long.SIZE) {
			return new Element<>(new Literal.LongLiteral(value.longValue(), span(literal)));
		}
		return new ParsingError<>(OUT_OF_RANGE, span(literal), span(constant));
	}

	private LanguageResult<Expr> string(SyntaxElement string) {
		if (!string.children().isEmpty()) {
			return parsingError(string, string.children().get(0));
		}

		String text = string.text();
		boolean raw = text.startsWith("\"\"\"");
		int quoteLength = raw ? 3 : 1;
		int contentStart = string.startOffset() + quoteLength;
		String content = text.substring(quoteLength, text.length() - quoteLength);

		FailureCollector failures = new FailureCollector();
		StringBuilder value = new StringBuilder();
		int i = 0;
		while (i < content.length()) {
			char c = content.charAt(i);
			if (c == '\\' && !raw) {
				int escapeLength = appendEscape(content, i, value);
				if (escapeLength < 0) {
					int escapeEnd = Math.min(i + 2, content.length());
					failures.add(new ParsingError<>("Illegal escape: " + content.substring(i, escapeEnd),
							span(string), source.span(contentStart + i, contentStart + escapeEnd)));
					i = escapeEnd;
				} else {
					i += escapeLength;
				}
			} else if (c == '$' && startsTemplateEntry(content, i + 1)) {
				int entryEnd = templateEntryEnd(content, i);
				failures.add(new UnsupportedConstruct<>(UnsupportedLanguageFeature.STRING_TEMPLATE,
						span(string), source.span(contentStart + i, contentStart + entryEnd)));
				i = entryEnd;
			} else {
				value.append(c);
				i++;
			}
		}

		return failures.elementIfNoFailures(() -> new Literal.StringLiteral(value.toString(), span(string)));
	}

	/**
	 * Decodes the escape starting at {@code index}.
	 *
	 * @return the number of characters consumed, or {@code -1} for an illegal escape
	 */
	private static int appendEscape(String content, int index, StringBuilder value) {
		if (index + 1 >= content.length()) {
			return -1;
		}
		char escaped = content.charAt(index + 1);
		switch (escaped) {
			case 't' -> value.append('\t');
			case 'b' -> value.append('\b');
			case 'n' -> value.append('\n');
			case 'r' -> value.append('\r');
			case '\'', '"', '\\', '$' -> value.append(escaped);
			case 'u' -> {
				if (index + 6 > content.length()) {
					return -1;
				}
				String hex = content.substring(index + 2, index + 6);
				if (!hex.chars().allMatch(GrammarToTree::isHexDigit)) {
					return -1;
				}
				value.append((char) Integer.parseInt(hex, 16));
				return 6;
			}
			default -> {
				return -1;
			}
		}
		return 2;
	}

	private static boolean isHexDigit(int c) {
		return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

	private static boolean startsTemplateEntry(String content, int index) {
		if (index >= content.length()) {
			return false;
		}
		char c = content.charAt(index);
		return c == '{' || c == '_' || Character.isLetter(c);
	}

	private static int templateEntryEnd(String content, int dollar) {
		int i = dollar + 1;
		if (content.charAt(i) == '{') {
			int depth = 0;
			while (i < content.length()) {
				char c = content.charAt(i++);
				if (c == '{') {
					depth++;
				} else if (c == '}' && --depth == 0) {
					break;
				}
			}
			return i;
		}
		while (i < content.length() && (content.charAt(i) == '_' || Character.isLetterOrDigit(content.charAt(i)))) {
			i++;
		}
		return i;
	}

	// failures and spans

	private void collectErrors(SyntaxElement element, FailureCollector failures) {
		for (SyntaxElement child : element.children()) {
			if (child.isError()) {
				failures.add(parsingError(element, child));
			}
		}
	}

	private <T> ParsingError<T> parsingError(SyntaxElement potential, SyntaxElement erroneous) {
		String message = erroneous.isError() ? erroneous.errorMessage() : "Unexpected " + erroneous.kind();
		return new ParsingError<>(message, span(potential), span(erroneous));
	}

	private <T> UnsupportedConstruct<T> unsupported(UnsupportedLanguageFeature feature, SyntaxElement potential,
			SyntaxElement erroneous) {
		return new UnsupportedConstruct<>(feature, span(potential), span(erroneous));
	}

	private SourceData span(SyntaxElement element) {
		return source.span(element.startOffset(), element.endOffset());
	}
}
