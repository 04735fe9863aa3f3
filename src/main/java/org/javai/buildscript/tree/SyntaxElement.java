package org.javai.buildscript.tree;

import java.util.List;
import org.javai.buildscript.syntax.SyntaxKind;

/**
 * The view of a concrete syntax node that the tree builder works against. Adapters present the
 * full tree and the light tree through this one interface, so classification is written once.
 * <p>
 * Offsets are relative to the start of the source unit being built.
 */
interface SyntaxElement {

	SyntaxKind kind();

	List<SyntaxElement> children();

	int startOffset();

	int endOffset();

	String text();

	/**
	 * The parser's message for {@link SyntaxKind#ERROR_ELEMENT} nodes, otherwise {@code null}.
	 */
	String errorMessage();

	default boolean isError() {
		return kind() == SyntaxKind.ERROR_ELEMENT;
	}
}
