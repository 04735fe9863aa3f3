package org.javai.buildscript.language;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders language trees and results as canonical text: one child per line, four spaces of
 * indentation per level, every element labelled with its variant and span.
 * <p>
 * The output is deterministic and is what tests compare against.
 */
public class LanguageTreePrinter implements LanguageTreeVisitor<Void> {

	private static final String INDENT = "    ";

	private final StringBuilder output = new StringBuilder();
	private int depth;

	private LanguageTreePrinter(int depth) {
		this.depth = depth;
	}

	/**
	 * Prints the header results followed by each top-level statement, separated by newlines.
	 */
	public static String print(LanguageTreeResult result) {
		List<String> entries = new ArrayList<>();
		for (LanguageResult<Import> header : result.imports()) {
			entries.add(print(header));
		}
		if (result.topLevelBlock() instanceof Element<Block> block) {
			for (DataStatement statement : block.element().content()) {
				entries.add(print(statement));
			}
		} else {
			entries.add(print(result.topLevelBlock()));
		}
		return String.join("\n", entries);
	}

	public static String print(LanguageTreeElement element) {
		LanguageTreePrinter printer = new LanguageTreePrinter(0);
		element.accept(printer);
		return printer.toString();
	}

	public static String print(LanguageResult<?> result) {
		LanguageTreePrinter printer = new LanguageTreePrinter(0);
		printer.printResult(result);
		return printer.toString();
	}

	@Override
	public Void visitBlock(Block block) {
		open("Block", block);
		for (DataStatement statement : block.content()) {
			output.append(nextIndent());
			deeper(statement);
			output.append('\n');
		}
		close();
		return null;
	}

	@Override
	public Void visitImport(Import anImport) {
		open("Import", anImport);
		output.append(nextIndent()).append("name parts = ").append(anImport.nameParts()).append('\n');
		close();
		return null;
	}

	@Override
	public Void visitAssignment(Assignment assignment) {
		open("Assignment", assignment);
		child("lhs", assignment.lhs());
		child("rhs", assignment.rhs());
		close();
		return null;
	}

	@Override
	public Void visitLocalValue(LocalValue localValue) {
		open("LocalValue", localValue);
		output.append(nextIndent()).append("name = ").append(localValue.name()).append('\n');
		child("rhs", localValue.rhs());
		close();
		return null;
	}

	@Override
	public Void visitErroneousStatement(ErroneousStatement erroneousStatement) {
		open("ErroneousStatement", erroneousStatement);
		depth++;
		printResult(erroneousStatement.failingResult());
		depth--;
		output.append('\n');
		close();
		return null;
	}

	@Override
	public Void visitFunctionCall(FunctionCall functionCall) {
		open("FunctionCall", functionCall);
		output.append(nextIndent()).append("name = ").append(functionCall.name()).append('\n');
		if (functionCall.receiver() != null) {
			child("receiver", functionCall.receiver());
		}
		if (functionCall.args().isEmpty()) {
			output.append(nextIndent()).append("args = []\n");
		} else {
			output.append(nextIndent()).append("args = [\n");
			depth++;
			for (FunctionArgument arg : functionCall.args()) {
				output.append(nextIndent());
				deeper(arg);
				output.append('\n');
			}
			depth--;
			output.append(nextIndent()).append("]\n");
		}
		close();
		return null;
	}

	@Override
	public Void visitPositionalArgument(FunctionArgument.Positional argument) {
		open("FunctionArgument.Positional", argument);
		child("expr", argument.expr());
		close();
		return null;
	}

	@Override
	public Void visitNamedArgument(FunctionArgument.Named argument) {
		open("FunctionArgument.Named", argument);
		output.append(nextIndent()).append("name = ").append(argument.name()).append('\n');
		child("expr", argument.expr());
		close();
		return null;
	}

	@Override
	public Void visitLambdaArgument(FunctionArgument.Lambda argument) {
		open("FunctionArgument.Lambda", argument);
		child("block", argument.block());
		close();
		return null;
	}

	@Override
	public Void visitPropertyAccess(PropertyAccess propertyAccess) {
		open("PropertyAccess", propertyAccess);
		if (propertyAccess.hasReceiver()) {
			child("receiver", propertyAccess.receiver());
		}
		output.append(nextIndent()).append("name = ").append(propertyAccess.name()).append('\n');
		close();
		return null;
	}

	@Override
	public Void visitBooleanLiteral(Literal.BooleanLiteral literal) {
		return value("BooleanLiteral", literal, String.valueOf(literal.value()));
	}

	@Override
	public Void visitIntLiteral(Literal.IntLiteral literal) {
		return value("IntLiteral", literal, String.valueOf(literal.value()));
	}

	@Override
	public Void visitLongLiteral(Literal.LongLiteral literal) {
		return value("LongLiteral", literal, String.valueOf(literal.value()));
	}

	@Override
	public Void visitStringLiteral(Literal.StringLiteral literal) {
		return value("StringLiteral", literal, escape(literal.value()));
	}

	@Override
	public Void visitNull(Null nullLiteral) {
		output.append("Null [").append(nullLiteral.sourceData().prettyPrint()).append(']');
		return null;
	}

	@Override
	public Void visitThis(This thisReference) {
		output.append("This [").append(thisReference.sourceData().prettyPrint()).append(']');
		return null;
	}

	/**
	 * Prints a result starting with the indentation of the current depth.
	 */
	private <T> void printResult(LanguageResult<T> result) {
		result.accept(new LanguageResultVisitor<T, Void>() {
			@Override
			public Void visitElement(Element<T> element) {
				output.append(indent());
				((LanguageTreeElement) element.element()).accept(LanguageTreePrinter.this);
				return null;
			}

			@Override
			public Void visitParsingError(ParsingError<T> parsingError) {
				output.append(indent()).append("ParsingError(\n");
				output.append(nextIndent()).append("message = ").append(parsingError.message()).append(",\n");
				failureSources(parsingError.potentialElementSource(), parsingError.erroneousSource());
				return null;
			}

			@Override
			public Void visitUnsupportedConstruct(UnsupportedConstruct<T> unsupportedConstruct) {
				output.append(indent()).append("UnsupportedConstruct(\n");
				output.append(nextIndent()).append("languageFeature = ")
						.append(unsupportedConstruct.languageFeature().name()).append(",\n");
				failureSources(unsupportedConstruct.potentialElementSource(), unsupportedConstruct.erroneousSource());
				return null;
			}

			@Override
			public Void visitMultipleFailures(MultipleFailuresResult<T> multipleFailures) {
				output.append(indent()).append("MultipleFailures(\n");
				depth++;
				for (FailingResult<?> failure : multipleFailures.failures()) {
					printResult(failure);
					output.append('\n');
				}
				depth--;
				close();
				return null;
			}
		});
	}

	private void failureSources(SourceData potentialElementSource, SourceData erroneousSource) {
		output.append(nextIndent()).append("potentialElementSource = ")
				.append(potentialElementSource.prettyPrint()).append(",\n");
		output.append(nextIndent()).append("erroneousSource = ").append(erroneousSource.prettyPrint()).append('\n');
		close();
	}

	private Void value(String label, LanguageTreeElement element, String value) {
		output.append(label).append(" [").append(element.sourceData().prettyPrint()).append("] (")
				.append(value).append(')');
		return null;
	}

	private void open(String label, LanguageTreeElement element) {
		output.append(label).append(" [").append(element.sourceData().prettyPrint()).append("] (\n");
	}

	private void child(String name, LanguageTreeElement element) {
		output.append(nextIndent()).append(name).append(" = ");
		deeper(element);
		output.append('\n');
	}

	private void deeper(LanguageTreeElement element) {
		depth++;
		element.accept(this);
		depth--;
	}

	private void close() {
		output.append(indent()).append(')');
	}

	private String indent() {
		return INDENT.repeat(depth);
	}

	private String nextIndent() {
		return INDENT.repeat(depth + 1);
	}

	private static String escape(String value) {
		return value.replace("\\", "\\\\")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}

	@Override
	public String toString() {
		return output.toString();
	}
}
