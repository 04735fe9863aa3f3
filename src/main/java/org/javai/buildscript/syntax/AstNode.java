package org.javai.buildscript.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A node of the full concrete syntax tree. Every node carries its own source text.
 *
 * @param kind the node kind
 * @param startOffset offset of the first character
 * @param endOffset offset after the last character
 * @param text the source text covered by the node
 * @param children child nodes in source order
 * @param errorMessage the parser's message for {@link SyntaxKind#ERROR_ELEMENT} nodes, otherwise {@code null}
 */
public record AstNode(
		SyntaxKind kind,
		int startOffset,
		int endOffset,
		String text,
		List<AstNode> children,
		String errorMessage
) {

	public AstNode {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(text, "text must not be null");
		children = List.copyOf(children);
	}

	public boolean isError() {
		return kind == SyntaxKind.ERROR_ELEMENT;
	}
}
