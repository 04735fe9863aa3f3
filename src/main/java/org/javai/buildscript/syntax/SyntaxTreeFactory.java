package org.javai.buildscript.syntax;

import java.util.List;

/**
 * Receives the nodes recognized by {@link ScriptParser}, children before their parent.
 * <p>
 * One parser drives different tree representations through this interface; offsets are
 * absolute in the parsed text.
 *
 * @param <N> the node handle of the produced representation
 */
public interface SyntaxTreeFactory<N> {

	N leaf(SyntaxKind kind, int startOffset, int endOffset);

	N node(SyntaxKind kind, int startOffset, int endOffset, List<N> children);

	N error(String message, int startOffset, int endOffset);
}
