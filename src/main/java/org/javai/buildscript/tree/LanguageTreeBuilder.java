package org.javai.buildscript.tree;

import org.javai.buildscript.language.LanguageTreeResult;
import org.javai.buildscript.language.SourceIdentifier;
import org.javai.buildscript.syntax.AstNode;
import org.javai.buildscript.syntax.LightTree;

/**
 * Builds the language tree of one source unit from its concrete syntax.
 * <p>
 * Both entry points are pure and never throw for malformed input: every problem is reported
 * as a failure inside the returned {@link LanguageTreeResult}. For the same source text they
 * produce equal results.
 * <p>
 * Building recurses along the nesting of the syntax tree; input nested thousands of levels
 * deep can exhaust the thread's stack.
 */
public interface LanguageTreeBuilder {

	/**
	 * Builds from a full syntax tree whose nodes carry their own text.
	 */
	LanguageTreeResult build(AstNode syntaxTree, SourceIdentifier sourceIdentifier);

	/**
	 * Builds from a light tree parsed out of {@code sourceText}, where the source unit starts at
	 * {@code sourceOffset}. The light tree's offsets are absolute in {@code sourceText}.
	 */
	LanguageTreeResult build(LightTree lightTree, String sourceText, int sourceOffset, SourceIdentifier sourceIdentifier);
}
