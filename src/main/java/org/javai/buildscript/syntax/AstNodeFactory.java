package org.javai.buildscript.syntax;

import java.util.List;

/**
 * Materializes {@link AstNode}s, slicing each node's text out of the parsed source.
 */
public class AstNodeFactory implements SyntaxTreeFactory<AstNode> {

	private final String text;

	public AstNodeFactory(String text) {
		this.text = text != null ? text : "";
	}

	@Override
	public AstNode leaf(SyntaxKind kind, int startOffset, int endOffset) {
		return new AstNode(kind, startOffset, endOffset, text.substring(startOffset, endOffset), List.of(), null);
	}

	@Override
	public AstNode node(SyntaxKind kind, int startOffset, int endOffset, List<AstNode> children) {
		return new AstNode(kind, startOffset, endOffset, text.substring(startOffset, endOffset), children, null);
	}

	@Override
	public AstNode error(String message, int startOffset, int endOffset) {
		return new AstNode(SyntaxKind.ERROR_ELEMENT, startOffset, endOffset,
				text.substring(startOffset, endOffset), List.of(), message);
	}
}
