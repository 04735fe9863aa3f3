package org.javai.buildscript.diagnostics;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.buildscript.language.UnsupportedLanguageFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Guidance for each {@link UnsupportedLanguageFeature}, loaded from YAML:
 *
 * <pre>
 * features:
 *   STAR_IMPORT:
 *     message: Star imports are not supported
 *     hint: Import each name explicitly
 * </pre>
 *
 * Features missing from the YAML get a generic message. Catalogs are immutable.
 */
public final class LanguageFeatureCatalog {

	private static final Logger logger = LoggerFactory.getLogger(LanguageFeatureCatalog.class);

	static final String DEFAULT_RESOURCE = "META-INF/buildscript-language-features.yml";

	private final Map<UnsupportedLanguageFeature, FeatureGuidance> guidance;

	private LanguageFeatureCatalog(Map<UnsupportedLanguageFeature, FeatureGuidance> guidance) {
		this.guidance = guidance;
	}

	/**
	 * Load the catalog bundled with this library.
	 *
	 * @throws LanguageFeatureCatalogException if the resource is missing or malformed
	 */
	public static LanguageFeatureCatalog loadDefault() {
		ClassLoader loader = LanguageFeatureCatalog.class.getClassLoader();
		try (InputStream is = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (is == null) {
				throw new LanguageFeatureCatalogException("Resource not found: " + DEFAULT_RESOURCE);
			}
			return load(is);
		} catch (LanguageFeatureCatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new LanguageFeatureCatalogException("Failed to load language features from resource: " + DEFAULT_RESOURCE, e);
		}
	}

	public static LanguageFeatureCatalog load(InputStream inputStream) {
		Objects.requireNonNull(inputStream, "inputStream must not be null");
		try {
			return fromYaml(new Yaml().load(inputStream));
		} catch (LanguageFeatureCatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new LanguageFeatureCatalogException("Failed to parse language features from input stream", e);
		}
	}

	public static LanguageFeatureCatalog load(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (Reader reader = Files.newBufferedReader(path)) {
			return fromYaml(new Yaml().load(reader));
		} catch (LanguageFeatureCatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new LanguageFeatureCatalogException("Failed to parse language features from path: " + path, e);
		}
	}

	public static LanguageFeatureCatalog parseString(String yamlContent) {
		Objects.requireNonNull(yamlContent, "yamlContent must not be null");
		try {
			return fromYaml(new Yaml().load(yamlContent));
		} catch (LanguageFeatureCatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new LanguageFeatureCatalogException("Failed to parse language features from string", e);
		}
	}

	/**
	 * The guidance for {@code feature}; a generic message if the catalog has none.
	 */
	public FeatureGuidance guidanceFor(UnsupportedLanguageFeature feature) {
		Objects.requireNonNull(feature, "feature must not be null");
		FeatureGuidance featureGuidance = guidance.get(feature);
		if (featureGuidance != null) {
			return featureGuidance;
		}
		return new FeatureGuidance("Unsupported language feature: " + feature.name(), null);
	}

	/**
	 * The features the catalog has specific guidance for.
	 */
	public Set<UnsupportedLanguageFeature> coveredFeatures() {
		return guidance.isEmpty() ? Set.of() : Set.copyOf(guidance.keySet());
	}

	private static LanguageFeatureCatalog fromYaml(Object data) {
		if (!(data instanceof Map<?, ?> root) || !(root.get("features") instanceof Map<?, ?> features)) {
			throw new LanguageFeatureCatalogException("Expected a 'features' mapping at the top level");
		}

		Map<UnsupportedLanguageFeature, FeatureGuidance> guidance = new EnumMap<>(UnsupportedLanguageFeature.class);
		for (Map.Entry<?, ?> entry : features.entrySet()) {
			UnsupportedLanguageFeature feature = featureNamed(String.valueOf(entry.getKey()));
			if (!(entry.getValue() instanceof Map<?, ?> fields)) {
				throw new LanguageFeatureCatalogException("Expected a mapping for feature " + feature.name());
			}
			Object message = fields.get("message");
			if (message == null) {
				throw new LanguageFeatureCatalogException("Missing message for feature " + feature.name());
			}
			Object hint = fields.get("hint");
			guidance.put(feature, new FeatureGuidance(String.valueOf(message), hint != null ? String.valueOf(hint) : null));
		}

		Set<UnsupportedLanguageFeature> missing = EnumSet.allOf(UnsupportedLanguageFeature.class);
		missing.removeAll(guidance.keySet());
		if (!missing.isEmpty()) {
			logger.warn("No guidance for language features {}; using a generic message", missing);
		}
		logger.debug("Loaded guidance for {} language features", guidance.size());
		return new LanguageFeatureCatalog(guidance);
	}

	private static UnsupportedLanguageFeature featureNamed(String name) {
		try {
			return UnsupportedLanguageFeature.valueOf(name);
		} catch (IllegalArgumentException e) {
			throw new LanguageFeatureCatalogException("Unknown language feature: " + name, e);
		}
	}
}
