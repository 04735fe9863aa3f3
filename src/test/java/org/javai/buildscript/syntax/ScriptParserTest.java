package org.javai.buildscript.syntax;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ScriptParserTest {

	@Test
	void emptyScriptHasEmptyImportListAndBody() {
		AstNode file = ScriptParser.parseToAst("");

		assertThat(file.kind()).isEqualTo(SyntaxKind.FILE);
		assertThat(file.children()).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.IMPORT_LIST, SyntaxKind.BLOCK);
		assertThat(body(file).children()).isEmpty();
	}

	@Test
	void parseCallWithPositionalArgument() {
		AstNode file = ScriptParser.parseToAst("include(\":a\")");

		assertThat(describe(body(file))).isEqualTo(
				"BLOCK[0..13](CALL_EXPRESSION[0..13](REFERENCE_EXPRESSION[0..7], "
						+ "VALUE_ARGUMENT_LIST[7..13](VALUE_ARGUMENT[8..12](STRING_TEMPLATE[8..12]))))");
		assertThat(body(file).children().get(0).text()).isEqualTo("include(\":a\")");
	}

	@Test
	void parseNamedArgument() {
		AstNode call = statements("include(projectPath = \":b\")").get(0);
		AstNode argument = call.children().get(1).children().get(0);

		assertThat(argument.children()).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.VALUE_ARGUMENT_NAME, SyntaxKind.STRING_TEMPLATE);
		assertThat(argument.children().get(0).text()).isEqualTo("projectPath");
	}

	@Test
	void parseAssignmentAsBinaryExpression() {
		AstNode assignment = statements("rootProject.name = \"test-value\"").get(0);

		assertThat(assignment.kind()).isEqualTo(SyntaxKind.BINARY_EXPRESSION);
		assertThat(assignment.children()).extracting(AstNode::kind).containsExactly(
				SyntaxKind.DOT_QUALIFIED_EXPRESSION, SyntaxKind.OPERATION_REFERENCE, SyntaxKind.STRING_TEMPLATE);
		assertThat(assignment.children().get(1).text()).isEqualTo("=");
	}

	@Test
	void parseHeaderDirectives() {
		AstNode file = ScriptParser.parseToAst("package a.b\nimport c.d\nimport e.*\nimport f.g as h\nfoo()");

		assertThat(file.children()).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.PACKAGE_DIRECTIVE, SyntaxKind.IMPORT_LIST, SyntaxKind.BLOCK);
		List<AstNode> imports = file.children().get(1).children();
		assertThat(imports).extracting(AstNode::text)
				.containsExactly("import c.d", "import e.*", "import f.g as h");
		assertThat(imports.get(1).children()).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.IDENTIFIER, SyntaxKind.IMPORT_STAR);
		assertThat(imports.get(2).children()).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.IDENTIFIER, SyntaxKind.IDENTIFIER, SyntaxKind.IMPORT_ALIAS);
		assertThat(body(file).children()).hasSize(1);
	}

	@Test
	void trailingLambdaMustStartOnTheSameLine() {
		assertThat(statements("f {\n}")).extracting(AstNode::kind).containsExactly(SyntaxKind.CALL_EXPRESSION);
		assertThat(statements("f\n{\n}")).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.REFERENCE_EXPRESSION, SyntaxKind.LAMBDA_EXPRESSION);
	}

	@Test
	void lambdaBlockCoversTheTextBetweenTheBraces() {
		AstNode call = statements("f { x() }").get(0);
		AstNode lambdaArgument = call.children().get(1);
		AstNode block = lambdaArgument.children().get(0).children().get(0);

		assertThat(lambdaArgument.kind()).isEqualTo(SyntaxKind.LAMBDA_ARGUMENT);
		assertThat(lambdaArgument.text()).isEqualTo("{ x() }");
		assertThat(block.kind()).isEqualTo(SyntaxKind.BLOCK);
		assertThat(block.text()).isEqualTo(" x() ");
	}

	@Test
	void statementsAreSeparatedByNewlinesAndSemicolons() {
		assertThat(statements("a()\nb(); c()\n\n;d()")).extracting(AstNode::text)
				.containsExactly("a()", "b()", "c()", "d()");
	}

	@Test
	void newlinesInsideParenthesesAreInsignificant() {
		List<AstNode> statements = statements("f(\n    1,\n    2,\n)");

		assertThat(statements).hasSize(1);
		assertThat(statements.get(0).children().get(1).children()).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.VALUE_ARGUMENT, SyntaxKind.VALUE_ARGUMENT);
	}

	@Test
	void lineStartingWithDotContinuesTheExpression() {
		List<AstNode> statements = statements("a\n    .b()\n    ?.c");

		assertThat(statements).hasSize(1);
		assertThat(statements.get(0).kind()).isEqualTo(SyntaxKind.SAFE_ACCESS_EXPRESSION);
		assertThat(statements.get(0).children().get(0).kind()).isEqualTo(SyntaxKind.DOT_QUALIFIED_EXPRESSION);
	}

	@Test
	void binaryOperatorsFollowPrecedence() {
		AstNode expression = statements("a || b && c + d * e").get(0);

		assertThat(describeKinds(expression)).isEqualTo(
				"BINARY_EXPRESSION(REFERENCE_EXPRESSION, OPERATION_REFERENCE, "
						+ "BINARY_EXPRESSION(REFERENCE_EXPRESSION, OPERATION_REFERENCE, "
						+ "BINARY_EXPRESSION(REFERENCE_EXPRESSION, OPERATION_REFERENCE, "
						+ "BINARY_EXPRESSION(REFERENCE_EXPRESSION, OPERATION_REFERENCE, REFERENCE_EXPRESSION))))");
	}

	@Test
	void unexpectedTokenInStatementPositionBecomesErrorElement() {
		List<AstNode> statements = statements("a()\n) ]\nb()");

		assertThat(statements).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.CALL_EXPRESSION, SyntaxKind.ERROR_ELEMENT, SyntaxKind.CALL_EXPRESSION);
		assertThat(statements.get(1).errorMessage()).isEqualTo(ScriptParser.EXPECTING_ELEMENT);
		assertThat(statements.get(1).text()).isEqualTo(") ]");
	}

	@Test
	void trailingTokensOnTheSameLineBecomeSiblingError() {
		List<AstNode> statements = statements("a = 1 b c");

		assertThat(statements).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.BINARY_EXPRESSION, SyntaxKind.ERROR_ELEMENT);
		assertThat(statements.get(1).errorMessage()).isEqualTo(ScriptParser.UNEXPECTED_TOKENS);
		assertThat(statements.get(1).text()).isEqualTo("b c");
	}

	@Test
	void missingClosingParenthesisIsZeroWidthError() {
		AstNode arguments = statements("f(1").get(0).children().get(1);
		AstNode error = arguments.children().get(arguments.children().size() - 1);

		assertThat(error.isError()).isTrue();
		assertThat(error.errorMessage()).isEqualTo("Expecting ')'");
		assertThat(error.startOffset()).isEqualTo(3);
		assertThat(error.endOffset()).isEqualTo(3);
	}

	@Test
	void missingClosingBraceIsReportedInTheLambda() {
		AstNode lambda = statements("f {\n  a()").get(0).children().get(1).children().get(0);

		assertThat(lambda.children()).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.BLOCK, SyntaxKind.ERROR_ELEMENT);
		assertThat(lambda.children().get(0).children()).hasSize(1);
		assertThat(lambda.children().get(1).errorMessage()).isEqualTo("Expecting '}'");
	}

	@Test
	void missingInitializerIsErrorInsideProperty() {
		AstNode property = statements("val x =").get(0);

		assertThat(property.kind()).isEqualTo(SyntaxKind.PROPERTY);
		assertThat(property.children()).extracting(AstNode::kind)
				.containsExactly(SyntaxKind.VAL_KEYWORD, SyntaxKind.IDENTIFIER, SyntaxKind.ERROR_ELEMENT);
		assertThat(property.children().get(2).errorMessage()).isEqualTo(ScriptParser.EXPECTING_EXPRESSION);
	}

	@Test
	void unterminatedStringCarriesErrorChild() {
		AstNode string = statements("\"abc").get(0);

		assertThat(string.kind()).isEqualTo(SyntaxKind.STRING_TEMPLATE);
		assertThat(string.children()).singleElement()
				.satisfies(error -> assertThat(error.errorMessage()).isEqualTo("Expecting '\"'"));
	}

	@Test
	void lightTreeHasTheShapeOfTheFullTree() {
		String code = "import a.b\nrootProject.name = \"x\"\nf(1, n = 2) {\n    g { h() }\n}\nval v = -1\n) oops";

		AstNode file = ScriptParser.parseToAst(code);
		LightTree tree = ScriptParser.parseToLightTree(code, 0);

		assertThat(describe(tree, tree.root(), 0)).isEqualTo(describe(file));
	}

	@Test
	void lightTreeOffsetsStayAbsoluteInTheDocument() {
		String prefix = "plugins { }\n";
		String code = "include(\":a\")\nf { x }";

		AstNode file = ScriptParser.parseToAst(code);
		LightTree tree = ScriptParser.parseToLightTree(prefix + code, prefix.length());

		assertThat(tree.startOffset(tree.root())).isEqualTo(prefix.length());
		assertThat(describe(tree, tree.root(), prefix.length())).isEqualTo(describe(file));
	}

	@Test
	void lightTreeKeepsErrorMessages() {
		LightTree tree = ScriptParser.parseToLightTree(")", 0);
		int block = tree.children(tree.root()).get(1);
		int error = tree.children(block).get(0);

		assertThat(tree.kind(error)).isEqualTo(SyntaxKind.ERROR_ELEMENT);
		assertThat(tree.errorMessage(error)).isEqualTo(ScriptParser.EXPECTING_ELEMENT);
	}

	private static AstNode body(AstNode file) {
		return file.children().get(file.children().size() - 1);
	}

	private static List<AstNode> statements(String code) {
		return body(ScriptParser.parseToAst(code)).children();
	}

	private static String describe(AstNode node) {
		String self = node.kind() + "[" + node.startOffset() + ".." + node.endOffset() + "]";
		if (node.children().isEmpty()) {
			return self;
		}
		return self + node.children().stream()
				.map(ScriptParserTest::describe)
				.collect(Collectors.joining(", ", "(", ")"));
	}

	private static String describeKinds(AstNode node) {
		if (node.children().isEmpty()) {
			return node.kind().name();
		}
		return node.kind() + node.children().stream()
				.map(ScriptParserTest::describeKinds)
				.collect(Collectors.joining(", ", "(", ")"));
	}

	private static String describe(LightTree tree, int node, int shift) {
		String self = tree.kind(node) + "[" + (tree.startOffset(node) - shift) + ".." + (tree.endOffset(node) - shift) + "]";
		List<Integer> children = tree.children(node);
		if (children.isEmpty()) {
			return self;
		}
		return self + children.stream()
				.map(child -> describe(tree, child, shift))
				.collect(Collectors.joining(", ", "(", ")"));
	}
}
