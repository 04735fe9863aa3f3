package org.javai.buildscript.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import org.apache.logging.log4j.Level;
import org.javai.buildscript.language.UnsupportedLanguageFeature;
import org.javai.buildscript.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LanguageFeatureCatalog")
class LanguageFeatureCatalogTest {

	@Nested
	@DisplayName("Bundled catalog")
	class BundledCatalog {

		@Test
		@DisplayName("Should cover every unsupported language feature")
		void shouldCoverEveryFeature() {
			LanguageFeatureCatalog catalog = LanguageFeatureCatalog.loadDefault();

			assertThat(catalog.coveredFeatures()).isEqualTo(EnumSet.allOf(UnsupportedLanguageFeature.class));
		}

		@Test
		@DisplayName("Should provide message and hint")
		void shouldProvideMessageAndHint() {
			FeatureGuidance guidance = LanguageFeatureCatalog.loadDefault()
					.guidanceFor(UnsupportedLanguageFeature.STAR_IMPORT);

			assertThat(guidance.message()).isEqualTo("Star imports are not supported");
			assertThat(guidance.hint()).isEqualTo("Import each name explicitly");
		}

		@Test
		@DisplayName("Should leave the hint empty where none is known")
		void shouldAllowMissingHint() {
			FeatureGuidance guidance = LanguageFeatureCatalog.loadDefault()
					.guidanceFor(UnsupportedLanguageFeature.CONTROL_FLOW);

			assertThat(guidance.message()).isNotBlank();
			assertThat(guidance.hint()).isNull();
		}
	}

	@Nested
	@DisplayName("Custom catalogs")
	class CustomCatalogs {

		@Test
		@DisplayName("Should fall back to a generic message and warn about missing features")
		void shouldFallBackForMissingFeatures() {
			String yaml = """
					features:
					  STAR_IMPORT:
					    message: No stars here
					""";

			try (LogCaptorAppender captor = LogCaptorAppender.capture(LanguageFeatureCatalog.class, Level.DEBUG)) {
				LanguageFeatureCatalog catalog = LanguageFeatureCatalog.parseString(yaml);

				assertThat(catalog.coveredFeatures()).containsExactly(UnsupportedLanguageFeature.STAR_IMPORT);
				assertThat(catalog.guidanceFor(UnsupportedLanguageFeature.STAR_IMPORT))
						.isEqualTo(new FeatureGuidance("No stars here", null));
				assertThat(catalog.guidanceFor(UnsupportedLanguageFeature.INDEXING))
						.isEqualTo(new FeatureGuidance("Unsupported language feature: INDEXING", null));
				assertThat(captor.messagesAt(Level.WARN)).singleElement()
						.satisfies(message -> assertThat(message)
								.startsWith("No guidance for language features [")
								.contains("INDEXING")
								.doesNotContain("STAR_IMPORT"));
				assertThat(captor.messagesAt(Level.DEBUG))
						.containsExactly("Loaded guidance for 1 language features");
			}
		}

		@Test
		@DisplayName("Should load from a stream")
		void shouldLoadFromStream() {
			byte[] yaml = "features:\n  INDEXING:\n    message: No indexing\n    hint: Call get()\n"
					.getBytes(StandardCharsets.UTF_8);

			LanguageFeatureCatalog catalog = LanguageFeatureCatalog.load(new ByteArrayInputStream(yaml));

			assertThat(catalog.guidanceFor(UnsupportedLanguageFeature.INDEXING))
					.isEqualTo(new FeatureGuidance("No indexing", "Call get()"));
		}

		@Test
		@DisplayName("Should load from a file")
		void shouldLoadFromFile(@TempDir Path tempDir) throws IOException {
			Path file = tempDir.resolve("features.yml");
			Files.writeString(file, "features:\n  CONTROL_FLOW:\n    message: No ifs\n");

			LanguageFeatureCatalog catalog = LanguageFeatureCatalog.load(file);

			assertThat(catalog.guidanceFor(UnsupportedLanguageFeature.CONTROL_FLOW).message()).isEqualTo("No ifs");
		}

		@Test
		@DisplayName("Should wrap failures to read a file")
		void shouldWrapMissingFile(@TempDir Path tempDir) {
			Path missing = tempDir.resolve("missing.yml");

			assertThatThrownBy(() -> LanguageFeatureCatalog.load(missing))
					.isInstanceOf(LanguageFeatureCatalogException.class)
					.hasMessageContaining("missing.yml")
					.hasCauseInstanceOf(IOException.class);
		}
	}

	@Nested
	@DisplayName("Malformed catalogs")
	class MalformedCatalogs {

		@Test
		@DisplayName("Should reject a document without a features mapping")
		void shouldRejectMissingFeatures() {
			assertThatThrownBy(() -> LanguageFeatureCatalog.parseString("other: 1"))
					.isInstanceOf(LanguageFeatureCatalogException.class)
					.hasMessage("Expected a 'features' mapping at the top level");
			assertThatThrownBy(() -> LanguageFeatureCatalog.parseString("features: [a, b]"))
					.isInstanceOf(LanguageFeatureCatalogException.class);
		}

		@Test
		@DisplayName("Should reject unknown feature names")
		void shouldRejectUnknownFeature() {
			assertThatThrownBy(() -> LanguageFeatureCatalog.parseString("features:\n  GOTO:\n    message: no\n"))
					.isInstanceOf(LanguageFeatureCatalogException.class)
					.hasMessage("Unknown language feature: GOTO");
		}

		@Test
		@DisplayName("Should reject a feature without a message")
		void shouldRejectMissingMessage() {
			assertThatThrownBy(() -> LanguageFeatureCatalog.parseString("features:\n  INDEXING:\n    hint: get()\n"))
					.isInstanceOf(LanguageFeatureCatalogException.class)
					.hasMessage("Missing message for feature INDEXING");
		}

		@Test
		@DisplayName("Should wrap YAML syntax errors")
		void shouldWrapSyntaxErrors() {
			assertThatThrownBy(() -> LanguageFeatureCatalog.parseString("features: [unclosed"))
					.isInstanceOf(LanguageFeatureCatalogException.class)
					.hasMessage("Failed to parse language features from string")
					.hasCauseInstanceOf(RuntimeException.class);
		}
	}
}
