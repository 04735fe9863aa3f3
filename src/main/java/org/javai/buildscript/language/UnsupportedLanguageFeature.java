package org.javai.buildscript.language;

/**
 * Language features that parse fine but are not part of the declarative subset.
 */
public enum UnsupportedLanguageFeature {
	PACKAGE_HEADER,
	STAR_IMPORT,
	IMPORT_ALIAS,
	LOCAL_VARIABLE,
	EXPLICIT_TYPE,
	UNINITIALIZED_VALUE,
	AUGMENTED_ASSIGNMENT,
	BINARY_OPERATOR,
	PREFIX_OPERATOR,
	SAFE_NAVIGATION,
	INDEXING,
	FLOATING_POINT_LITERAL,
	STRING_TEMPLATE,
	THIS_WITH_LABEL,
	LAMBDA_WITH_PARAMETERS,
	DETACHED_LAMBDA,
	CONTROL_FLOW
}
