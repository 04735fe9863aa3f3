package org.javai.buildscript.diagnostics;

import java.util.Objects;

/**
 * What to tell a script author who used an unsupported language feature.
 *
 * @param message describes the unsupported feature
 * @param hint how to rewrite the script, or {@code null} if there is no known alternative
 */
public record FeatureGuidance(String message, String hint) {

	public FeatureGuidance {
		Objects.requireNonNull(message, "message must not be null");
	}
}
