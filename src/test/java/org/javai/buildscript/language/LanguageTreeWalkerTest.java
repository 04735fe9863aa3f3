package org.javai.buildscript.language;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.buildscript.testsupport.ParseTestUtil.parseWithAst;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LanguageTreeWalker")
class LanguageTreeWalkerTest {

	@Test
	@DisplayName("Should visit elements before their children in source order")
	void shouldWalkPreOrder() {
		Block block = topLevelBlock("a.b(x = 1) { c = true }");
		List<String> visited = new ArrayList<>();

		LanguageTreeWalker.walkPreOrder(block, element -> visited.add(element.getClass().getSimpleName()));

		assertThat(visited).containsExactly(
				"Block",
				"FunctionCall",
				"PropertyAccess",
				"Named",
				"IntLiteral",
				"Lambda",
				"Block",
				"Assignment",
				"PropertyAccess",
				"BooleanLiteral");
	}

	@Test
	@DisplayName("Should not descend into the failure of an erroneous statement")
	void shouldNotDescendIntoFailures() {
		Block block = topLevelBlock("f(1.5)\ng()");

		assertThat(LanguageTreeWalker.children(block)).hasSize(2);
		assertThat(LanguageTreeWalker.children(block.content().get(0))).isEmpty();
		assertThat(LanguageTreeWalker.children(block.content().get(1))).isEmpty();
	}

	private static Block topLevelBlock(String code) {
		LanguageResult<Block> result = parseWithAst(code).topLevelBlock();
		assertThat(result).isInstanceOf(Element.class);
		return ((Element<Block>) result).element();
	}
}
