package org.javai.buildscript.syntax;

/**
 * Node kinds of the concrete syntax tree, shared by the full tree and the light tree.
 */
public enum SyntaxKind {
	FILE,
	PACKAGE_DIRECTIVE,
	IMPORT_LIST,
	IMPORT_DIRECTIVE,
	IMPORT_STAR,
	IMPORT_ALIAS,
	BLOCK,
	PROPERTY,
	VAL_KEYWORD,
	VAR_KEYWORD,
	TYPE_REFERENCE,
	IDENTIFIER,
	REFERENCE_EXPRESSION,
	DOT_QUALIFIED_EXPRESSION,
	SAFE_ACCESS_EXPRESSION,
	CALL_EXPRESSION,
	VALUE_ARGUMENT_LIST,
	VALUE_ARGUMENT,
	VALUE_ARGUMENT_NAME,
	LAMBDA_ARGUMENT,
	LAMBDA_EXPRESSION,
	LAMBDA_PARAMETERS,
	BINARY_EXPRESSION,
	PREFIX_EXPRESSION,
	OPERATION_REFERENCE,
	ARRAY_ACCESS_EXPRESSION,
	INDICES,
	PARENTHESIZED,
	IF_EXPRESSION,
	THIS_EXPRESSION,
	LABEL,
	INTEGER_CONSTANT,
	FLOAT_CONSTANT,
	BOOLEAN_CONSTANT,
	NULL,
	STRING_TEMPLATE,
	ERROR_ELEMENT
}
