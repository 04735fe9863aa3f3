package org.javai.buildscript.syntax;

import java.util.Arrays;
import java.util.List;

/**
 * Appends parser output to growable arrays and freezes them into a {@link LightTree}.
 */
public class LightTreeFactory implements SyntaxTreeFactory<Integer> {

	private static final int INITIAL_CAPACITY = 64;

	private SyntaxKind[] kinds = new SyntaxKind[INITIAL_CAPACITY];
	private int[] startOffsets = new int[INITIAL_CAPACITY];
	private int[] endOffsets = new int[INITIAL_CAPACITY];
	private int[] firstChildren = new int[INITIAL_CAPACITY];
	private int[] nextSiblings = new int[INITIAL_CAPACITY];
	private String[] errorMessages = new String[INITIAL_CAPACITY];
	private int size;

	@Override
	public Integer leaf(SyntaxKind kind, int startOffset, int endOffset) {
		return add(kind, startOffset, endOffset, null);
	}

	@Override
	public Integer node(SyntaxKind kind, int startOffset, int endOffset, List<Integer> children) {
		int node = add(kind, startOffset, endOffset, null);
		int previous = LightTree.NONE;
		for (int child : children) {
			if (previous == LightTree.NONE) {
				firstChildren[node] = child;
			} else {
				nextSiblings[previous] = child;
			}
			previous = child;
		}
		return node;
	}

	@Override
	public Integer error(String message, int startOffset, int endOffset) {
		return add(SyntaxKind.ERROR_ELEMENT, startOffset, endOffset, message);
	}

	public LightTree build(int root) {
		if (root < 0 || root >= size) {
			throw new IllegalArgumentException("Unknown root node " + root);
		}
		return new LightTree(
				Arrays.copyOf(kinds, size),
				Arrays.copyOf(startOffsets, size),
				Arrays.copyOf(endOffsets, size),
				Arrays.copyOf(firstChildren, size),
				Arrays.copyOf(nextSiblings, size),
				Arrays.copyOf(errorMessages, size),
				root
		);
	}

	private int add(SyntaxKind kind, int startOffset, int endOffset, String errorMessage) {
		if (size == kinds.length) {
			int capacity = size * 2;
			kinds = Arrays.copyOf(kinds, capacity);
			startOffsets = Arrays.copyOf(startOffsets, capacity);
			endOffsets = Arrays.copyOf(endOffsets, capacity);
			firstChildren = Arrays.copyOf(firstChildren, capacity);
			nextSiblings = Arrays.copyOf(nextSiblings, capacity);
			errorMessages = Arrays.copyOf(errorMessages, capacity);
		}
		kinds[size] = kind;
		startOffsets[size] = startOffset;
		endOffsets[size] = endOffset;
		firstChildren[size] = LightTree.NONE;
		nextSiblings[size] = LightTree.NONE;
		errorMessages[size] = errorMessage;
		return size++;
	}
}
