package org.javai.buildscript.language;

/**
 * A node of the language tree: the build script as the evaluator sees it, shaped by the supported
 * statements rather than by grammar productions.
 * <p>
 * The hierarchy is closed. Traversals go through {@link LanguageTreeVisitor}, so adding a
 * node kind is a compile error at every traversal site until it is handled there.
 */
public sealed interface LanguageTreeElement permits Block, DataStatement, FunctionArgument, Import {

	/**
	 * The extent of this node in its source unit.
	 */
	SourceData sourceData();

	<R> R accept(LanguageTreeVisitor<R> visitor);
}
