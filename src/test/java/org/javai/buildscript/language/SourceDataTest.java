package org.javai.buildscript.language;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Source spans")
class SourceDataTest {

	private static final SourceIdentifier SETTINGS = new SourceIdentifier("settings.gradle.kts");

	@Nested
	@DisplayName("Positions")
	class Positions {

		@Test
		@DisplayName("Should resolve 1-based lines and columns")
		void shouldResolveLinesAndColumns() {
			SourceText text = SourceText.of(SETTINGS, "foo()\n  bar()\n");

			SourceData bar = text.span(8, 13);

			assertThat(bar.text()).isEqualTo("bar()");
			assertThat(bar.startLine()).isEqualTo(2);
			assertThat(bar.startColumn()).isEqualTo(3);
			assertThat(bar.endLine()).isEqualTo(2);
			assertThat(bar.endColumn()).isEqualTo(8);
			assertThat(bar.length()).isEqualTo(5);
		}

		@Test
		@DisplayName("Should place an offset right after a newline on the next line")
		void shouldStartNextLineAfterNewline() {
			SourceText text = SourceText.of(SETTINGS, "a\nb");

			SourceData whole = text.span(0, 3);

			assertThat(whole.endLine()).isEqualTo(2);
			assertThat(whole.endColumn()).isEqualTo(2);
			assertThat(text.span(2, 2).startLine()).isEqualTo(2);
			assertThat(text.span(2, 2).startColumn()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should resolve spans of an embedded unit relative to the unit")
		void shouldResolveEmbeddedSpans() {
			SourceText text = SourceText.embedded(SETTINGS, "header\nfoo()\nbar()", 7);

			SourceData bar = text.span(6, 11);

			assertThat(text.length()).isEqualTo(11);
			assertThat(bar.text()).isEqualTo("bar()");
			assertThat(bar.startLine()).isEqualTo(2);
			assertThat(bar.startColumn()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should render the canonical span text")
		void shouldPrettyPrint() {
			SourceData span = SourceText.of(SETTINGS, "include(\":a\")").span(8, 12);

			assertThat(span.prettyPrint())
					.isEqualTo("indexes: 8..12, line/column: 1/9..1/13, file: settings.gradle.kts");
			assertThat(span).hasToString(span.prettyPrint());
		}
	}

	@Nested
	@DisplayName("Validation and equality")
	class ValidationAndEquality {

		@Test
		@DisplayName("Should reject spans outside the unit")
		void shouldRejectInvalidSpans() {
			SourceText text = SourceText.of(SETTINGS, "foo");

			assertThatThrownBy(() -> text.span(-1, 2)).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> text.span(2, 1)).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> text.span(0, 4))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("0..4");
		}

		@Test
		@DisplayName("Should reject a base offset outside the document")
		void shouldRejectInvalidBaseOffset() {
			assertThatThrownBy(() -> SourceText.embedded(SETTINGS, "foo", 4))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should compare spans by unit and range only")
		void shouldCompareByUnitAndRange() {
			SourceData plain = SourceText.of(SETTINGS, "foo()").span(0, 3);
			SourceData embedded = SourceText.embedded(SETTINGS, "// x\nfoo()", 5).span(0, 3);
			SourceData otherUnit = SourceText.of(new SourceIdentifier("build.gradle.kts"), "foo()").span(0, 3);

			assertThat(embedded).isEqualTo(plain).hasSameHashCodeAs(plain);
			assertThat(otherUnit).isNotEqualTo(plain);
			assertThat(plain.sourceIdentifier()).isEqualTo(SETTINGS);
		}
	}
}
