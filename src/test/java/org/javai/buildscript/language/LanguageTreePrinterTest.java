package org.javai.buildscript.language;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.buildscript.testsupport.ParseTestUtil.TEST_SOURCE;
import static org.javai.buildscript.testsupport.ParseTestUtil.parseWithAst;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LanguageTreePrinter")
class LanguageTreePrinterTest {

	@Test
	@DisplayName("Should print a call with its arguments")
	void shouldPrintCall() {
		String printed = LanguageTreePrinter.print(parseWithAst("include(\":a\")"));

		assertThat(printed).isEqualTo("""
				FunctionCall [indexes: 0..13, line/column: 1/1..1/14, file: test] (
				    name = include
				    args = [
				        FunctionArgument.Positional [indexes: 8..12, line/column: 1/9..1/13, file: test] (
				            expr = StringLiteral [indexes: 8..12, line/column: 1/9..1/13, file: test] (:a)
				        )
				    ]
				)""");
	}

	@Test
	@DisplayName("Should print an assignment to a qualified property")
	void shouldPrintAssignment() {
		String printed = LanguageTreePrinter.print(parseWithAst("rootProject.name = \"test-value\""));

		assertThat(printed).isEqualTo("""
				Assignment [indexes: 0..31, line/column: 1/1..1/32, file: test] (
				    lhs = PropertyAccess [indexes: 0..16, line/column: 1/1..1/17, file: test] (
				        receiver = PropertyAccess [indexes: 0..11, line/column: 1/1..1/12, file: test] (
				            name = rootProject
				        )
				        name = name
				    )
				    rhs = StringLiteral [indexes: 19..31, line/column: 1/20..1/32, file: test] (test-value)
				)""");
	}

	@Test
	@DisplayName("Should print header entries before statements")
	void shouldPrintHeaderFirst() {
		String printed = LanguageTreePrinter.print(parseWithAst("import a.b\nfoo"));

		assertThat(printed).isEqualTo("""
				Import [indexes: 0..10, line/column: 1/1..1/11, file: test] (
				    name parts = [a, b]
				)
				PropertyAccess [indexes: 11..14, line/column: 2/1..2/4, file: test] (
				    name = foo
				)""");
	}

	@Test
	@DisplayName("Should print the failure of an erroneous statement")
	void shouldPrintErroneousStatement() {
		String printed = LanguageTreePrinter.print(parseWithAst("a += 1"));

		assertThat(printed).isEqualTo("""
				ErroneousStatement [indexes: 0..6, line/column: 1/1..1/7, file: test] (
				    UnsupportedConstruct(
				        languageFeature = AUGMENTED_ASSIGNMENT,
				        potentialElementSource = indexes: 0..6, line/column: 1/1..1/7, file: test,
				        erroneousSource = indexes: 2..4, line/column: 1/3..1/5, file: test
				    )
				)""");
	}

	@Test
	@DisplayName("Should print every failure of a multiple failures result")
	void shouldPrintMultipleFailures() {
		SourceText text = SourceText.of(TEST_SOURCE, "f(x, y)");
		LanguageResult<Expr> result = new MultipleFailuresResult<>(List.of(
				new ParsingError<Expr>("bad x", text.span(0, 7), text.span(2, 3)),
				new UnsupportedConstruct<Expr>(UnsupportedLanguageFeature.INDEXING, text.span(0, 7), text.span(5, 6))));

		assertThat(LanguageTreePrinter.print(result)).isEqualTo("""
				MultipleFailures(
				    ParsingError(
				        message = bad x,
				        potentialElementSource = indexes: 0..7, line/column: 1/1..1/8, file: test,
				        erroneousSource = indexes: 2..3, line/column: 1/3..1/4, file: test
				    )
				    UnsupportedConstruct(
				        languageFeature = INDEXING,
				        potentialElementSource = indexes: 0..7, line/column: 1/1..1/8, file: test,
				        erroneousSource = indexes: 5..6, line/column: 1/6..1/7, file: test
				    )
				)""");
	}

	@Test
	@DisplayName("Should escape control characters in string values")
	void shouldEscapeStrings() {
		SourceText text = SourceText.of(TEST_SOURCE, "\"a\\tb\"");
		Literal.StringLiteral literal = new Literal.StringLiteral("a\tb\\\n", text.span(0, 6));

		assertThat(LanguageTreePrinter.print(literal))
				.isEqualTo("StringLiteral [indexes: 0..6, line/column: 1/1..1/7, file: test] (a\\tb\\\\\\n)");
	}

	@Test
	@DisplayName("Should print the same text for repeated builds")
	void shouldBeDeterministic() {
		String code = "plugins {\n    id(\"java\")\n}\nval v = 1.5\nf(a = null, this, 2L)";

		assertThat(LanguageTreePrinter.print(parseWithAst(code)))
				.isEqualTo(LanguageTreePrinter.print(parseWithAst(code)))
				.contains("Null [indexes: ")
				.contains("This [indexes: ")
				.contains("LongLiteral [indexes: 57..59, line/column: 5/19..5/21, file: test] (2)");
	}
}
