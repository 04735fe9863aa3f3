package org.javai.buildscript.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.buildscript.testsupport.ParseTestUtil.parseWithAst;
import static org.javai.buildscript.testsupport.ParseTestUtil.parseWithLightParser;

import java.util.List;
import org.javai.buildscript.language.LanguageTreePrinter;
import org.javai.buildscript.language.LanguageTreeResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Full tree and light tree adapters")
class AdapterEquivalenceTest {

	private static final List<String> CORPUS = List.of(
			"",
			"rootProject.name = \"test-value\"",
			"include(\":a\")\ninclude(\":b\" \":c\")\ninclude(\":d\")",
			"pluginManagement {\n    repositories {\n        gradlePluginPortal()\n    }\n}",
			"dependencyResolutionManagement { repositories { mavenCentral(); google() } }",
			"import org.gradle.api.Project\nimport a.*\nval p = project(path = \":lib\", configuration = null)",
			"package com.example\nfoo()",
			"val big = 4294967296\nval neg = -1\nval hex = 0xFF\nval yes = true",
			"val s = \"tab\\t \\u0041 \\q $name ${x}\"",
			"a.b.c(1) { d = \"e\" }",
			"a += 1\nvar b = 2\nval c: Int = 3\nval d",
			"f(1.5, a[0], b?.c, !d, e + f)",
			"if (a) b\nthis@outer\nthis\nf { x -> x }\nf({ })",
			"x\n    .y()\n    ?.z",
			"f(1\ng(",
			"val s = \"unterminated",
			") ] }\nfoo() bar",
			"f {\n    g(1.5)\n    h()\n"
	);

	@Test
	@DisplayName("Should build equal trees from both adapters")
	void shouldBuildEqualTrees() {
		for (String code : CORPUS) {
			LanguageTreeResult fromAst = parseWithAst(code);
			LanguageTreeResult fromLightTree = parseWithLightParser(code);

			assertThat(fromLightTree).as(code).isEqualTo(fromAst);
			assertThat(LanguageTreePrinter.print(fromLightTree)).as(code).isEqualTo(LanguageTreePrinter.print(fromAst));
		}
	}

	@Test
	@DisplayName("Should rebase spans of a script embedded in a larger document")
	void shouldRebaseEmbeddedScript() {
		String prefix = "// generated header\n\n";
		for (String code : CORPUS) {
			LanguageTreeResult fromAst = parseWithAst(code);
			LanguageTreeResult embedded = parseWithLightParser(prefix, code);

			assertThat(embedded).as(code).isEqualTo(fromAst);
			assertThat(LanguageTreePrinter.print(embedded)).as(code).isEqualTo(LanguageTreePrinter.print(fromAst));
		}
	}
}
