package org.javai.buildscript.tree;

import java.util.List;
import org.javai.buildscript.syntax.LightTree;
import org.javai.buildscript.syntax.SyntaxKind;

/**
 * Presents one node of a {@link LightTree} as a {@link SyntaxElement}. The light tree holds
 * absolute offsets into a document in which the source unit starts at {@code sourceOffset}; text
 * is sliced from that document on demand.
 */
final class LightSyntaxElement implements SyntaxElement {

	private final LightTree tree;
	private final int node;
	private final String document;
	private final int sourceOffset;

	LightSyntaxElement(LightTree tree, int node, String document, int sourceOffset) {
		this.tree = tree;
		this.node = node;
		this.document = document;
		this.sourceOffset = sourceOffset;
	}

	static LightSyntaxElement root(LightTree tree, String document, int sourceOffset) {
		return new LightSyntaxElement(tree, tree.root(), document, sourceOffset);
	}

	@Override
	public SyntaxKind kind() {
		return tree.kind(node);
	}

	@Override
	public List<SyntaxElement> children() {
		return tree.children(node).stream()
				.<SyntaxElement>map(child -> new LightSyntaxElement(tree, child, document, sourceOffset))
				.toList();
	}

	@Override
	public int startOffset() {
		return tree.startOffset(node) - sourceOffset;
	}

	@Override
	public int endOffset() {
		return tree.endOffset(node) - sourceOffset;
	}

	@Override
	public String text() {
		return document.substring(tree.startOffset(node), tree.endOffset(node));
	}

	@Override
	public String errorMessage() {
		return tree.errorMessage(node);
	}
}
