package org.javai.buildscript.language;

import java.util.Objects;

/**
 * A contiguous range of a source unit: start inclusive, end exclusive, both relative to the
 * unit's own text.
 * <p>
 * Spans are coordinates, not copies: {@link #text()} reads from the borrowed source text on
 * demand. Two spans are equal when they name the same source unit and the same range,
 * regardless of which text instance they were created over.
 */
public final class SourceData {

	private final SourceText source;
	private final int startOffset;
	private final int endOffset;

	SourceData(SourceText source, int startOffset, int endOffset) {
		this.source = Objects.requireNonNull(source, "source must not be null");
		if (startOffset < 0 || endOffset < startOffset || endOffset > source.length()) {
			throw new IllegalArgumentException("Invalid span " + startOffset + ".." + endOffset
					+ " in a source of length " + source.length());
		}
		this.startOffset = startOffset;
		this.endOffset = endOffset;
	}

	public SourceIdentifier sourceIdentifier() {
		return source.identifier();
	}

	public int startOffset() {
		return startOffset;
	}

	public int endOffset() {
		return endOffset;
	}

	public int length() {
		return endOffset - startOffset;
	}

	public int startLine() {
		return source.lineOf(startOffset);
	}

	public int startColumn() {
		return source.columnOf(startOffset);
	}

	public int endLine() {
		return source.lineOf(endOffset);
	}

	public int endColumn() {
		return source.columnOf(endOffset);
	}

	public String text() {
		return source.slice(startOffset, endOffset);
	}

	/**
	 * Renders the span for diagnostics and canonical tree output.
	 */
	public String prettyPrint() {
		return "indexes: " + startOffset + ".." + endOffset
				+ ", line/column: " + startLine() + "/" + startColumn() + ".." + endLine() + "/" + endColumn()
				+ ", file: " + source.identifier().fileIdentifier();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourceData other)) {
			return false;
		}
		return startOffset == other.startOffset
				&& endOffset == other.endOffset
				&& source.identifier().equals(other.source.identifier());
	}

	@Override
	public int hashCode() {
		return Objects.hash(source.identifier(), startOffset, endOffset);
	}

	@Override
	public String toString() {
		return prettyPrint();
	}
}
