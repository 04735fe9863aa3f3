package org.javai.buildscript.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * A compact concrete syntax tree: nodes are indexes into parallel arrays of kinds, offsets and
 * sibling links. The tree holds no text; readers slice it from the source it was parsed from.
 * <p>
 * Offsets are absolute in that source, which may be a larger document than the parsed unit.
 */
public final class LightTree {

	static final int NONE = -1;

	private final SyntaxKind[] kinds;
	private final int[] startOffsets;
	private final int[] endOffsets;
	private final int[] firstChildren;
	private final int[] nextSiblings;
	private final String[] errorMessages;
	private final int root;

	LightTree(SyntaxKind[] kinds, int[] startOffsets, int[] endOffsets, int[] firstChildren, int[] nextSiblings,
			String[] errorMessages, int root) {
		this.kinds = kinds;
		this.startOffsets = startOffsets;
		this.endOffsets = endOffsets;
		this.firstChildren = firstChildren;
		this.nextSiblings = nextSiblings;
		this.errorMessages = errorMessages;
		this.root = root;
	}

	public int root() {
		return root;
	}

	public int size() {
		return kinds.length;
	}

	public SyntaxKind kind(int node) {
		return kinds[node];
	}

	public int startOffset(int node) {
		return startOffsets[node];
	}

	public int endOffset(int node) {
		return endOffsets[node];
	}

	public String errorMessage(int node) {
		return errorMessages[node];
	}

	public List<Integer> children(int node) {
		List<Integer> children = new ArrayList<>();
		for (int child = firstChildren[node]; child != NONE; child = nextSiblings[child]) {
			children.add(child);
		}
		return children;
	}
}
