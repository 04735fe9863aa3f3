package org.javai.buildscript.language;

import java.util.Arrays;
import java.util.Objects;

/**
 * The text of one source unit as seen by the spans pointing into it.
 * <p>
 * The text itself is borrowed, never copied: {@code text} may be a larger document in which
 * the unit starts at {@code baseOffset}. Offsets handed to {@link #span(int, int)} are relative
 * to the unit. Line starts are computed once so that every span of a build can resolve its
 * line and column without rescanning the text.
 */
public final class SourceText {

	private final SourceIdentifier identifier;
	private final CharSequence text;
	private final int baseOffset;
	private final int length;
	private final int[] lineStarts;

	private SourceText(SourceIdentifier identifier, CharSequence text, int baseOffset) {
		this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
		this.text = Objects.requireNonNull(text, "text must not be null");
		if (baseOffset < 0 || baseOffset > text.length()) {
			throw new IllegalArgumentException(
					"Base offset " + baseOffset + " is outside of a text of length " + text.length());
		}
		this.baseOffset = baseOffset;
		this.length = text.length() - baseOffset;
		this.lineStarts = computeLineStarts(text, baseOffset);
	}

	public static SourceText of(SourceIdentifier identifier, CharSequence text) {
		return new SourceText(identifier, text, 0);
	}

	/**
	 * A unit embedded in a larger document, starting at {@code baseOffset}.
	 */
	public static SourceText embedded(SourceIdentifier identifier, CharSequence document, int baseOffset) {
		return new SourceText(identifier, document, baseOffset);
	}

	public SourceIdentifier identifier() {
		return identifier;
	}

	public int length() {
		return length;
	}

	public SourceData span(int startOffset, int endOffset) {
		return new SourceData(this, startOffset, endOffset);
	}

	String slice(int startOffset, int endOffset) {
		return text.subSequence(baseOffset + startOffset, baseOffset + endOffset).toString();
	}

	/**
	 * 1-based line of a unit-relative offset.
	 */
	int lineOf(int offset) {
		int index = Arrays.binarySearch(lineStarts, offset);
		return index >= 0 ? index + 1 : -index - 1;
	}

	/**
	 * 1-based column of a unit-relative offset.
	 */
	int columnOf(int offset) {
		return offset - lineStarts[lineOf(offset) - 1] + 1;
	}

	private static int[] computeLineStarts(CharSequence text, int from) {
		int count = 1;
		for (int i = from; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				count++;
			}
		}
		int[] starts = new int[count];
		int line = 1;
		for (int i = from; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				starts[line++] = i - from + 1;
			}
		}
		return starts;
	}
}
