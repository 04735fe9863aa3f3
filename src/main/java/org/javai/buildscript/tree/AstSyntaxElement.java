package org.javai.buildscript.tree;

import java.util.List;
import org.javai.buildscript.syntax.AstNode;
import org.javai.buildscript.syntax.SyntaxKind;

/**
 * Presents an {@link AstNode} as a {@link SyntaxElement}. Offsets are rebased on the root node,
 * whose text is the whole source unit.
 */
final class AstSyntaxElement implements SyntaxElement {

	private final AstNode node;
	private final int baseOffset;

	AstSyntaxElement(AstNode node, int baseOffset) {
		this.node = node;
		this.baseOffset = baseOffset;
	}

	static AstSyntaxElement root(AstNode root) {
		return new AstSyntaxElement(root, root.startOffset());
	}

	@Override
	public SyntaxKind kind() {
		return node.kind();
	}

	@Override
	public List<SyntaxElement> children() {
		return node.children().stream()
				.<SyntaxElement>map(child -> new AstSyntaxElement(child, baseOffset))
				.toList();
	}

	@Override
	public int startOffset() {
		return node.startOffset() - baseOffset;
	}

	@Override
	public int endOffset() {
		return node.endOffset() - baseOffset;
	}

	@Override
	public String text() {
		return node.text();
	}

	@Override
	public String errorMessage() {
		return node.errorMessage();
	}
}
