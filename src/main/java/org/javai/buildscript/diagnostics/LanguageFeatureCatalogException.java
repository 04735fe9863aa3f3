package org.javai.buildscript.diagnostics;

/**
 * Exception thrown when a language feature catalog cannot be loaded.
 */
public class LanguageFeatureCatalogException extends RuntimeException {

	public LanguageFeatureCatalogException(String message) {
		super(message);
	}

	public LanguageFeatureCatalogException(String message, Throwable cause) {
		super(message, cause);
	}
}
