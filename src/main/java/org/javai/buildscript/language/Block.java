package org.javai.buildscript.language;

import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of statements: the body of a script or of a lambda argument.
 * <p>
 * Statements that could not be built stay in place as {@link ErroneousStatement}s, so a block
 * is always well-formed and its entries keep their source order.
 */
public record Block(List<DataStatement> content, SourceData sourceData) implements LanguageTreeElement {

	public Block {
		content = List.copyOf(content);
		Objects.requireNonNull(sourceData, "sourceData must not be null");
	}

	/**
	 * The block's entries as results: successful statements as {@link Element}s, erroneous ones
	 * as the failure they carry.
	 */
	public List<LanguageResult<DataStatement>> results() {
		return content.stream()
				.map(Block::toResult)
				.toList();
	}

	private static LanguageResult<DataStatement> toResult(DataStatement statement) {
		if (statement instanceof ErroneousStatement erroneous) {
			return erroneous.failingResult().propagate();
		}
		return new Element<>(statement);
	}

	@Override
	public <R> R accept(LanguageTreeVisitor<R> visitor) {
		return visitor.visitBlock(this);
	}
}
