package org.javai.buildscript.language;

/**
 * Visitor over every {@link LanguageResult} variant.
 *
 * @param <T> the element type of the visited result
 * @param <R> the result type of the visit
 */
public interface LanguageResultVisitor<T, R> {

	R visitElement(Element<T> element);

	R visitParsingError(ParsingError<T> parsingError);

	R visitUnsupportedConstruct(UnsupportedConstruct<T> unsupportedConstruct);

	R visitMultipleFailures(MultipleFailuresResult<T> multipleFailures);
}
