package org.javai.buildscript.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.buildscript.language.Block;
import org.javai.buildscript.language.Element;
import org.javai.buildscript.language.ErroneousStatement;
import org.javai.buildscript.language.FailingResult;
import org.javai.buildscript.language.Import;
import org.javai.buildscript.language.LanguageResult;
import org.javai.buildscript.language.LanguageResultVisitor;
import org.javai.buildscript.language.LanguageTreeResult;
import org.javai.buildscript.language.LanguageTreeWalker;
import org.javai.buildscript.language.MultipleFailuresResult;
import org.javai.buildscript.language.ParsingError;
import org.javai.buildscript.language.UnsupportedConstruct;

/**
 * Flattens every failure of a {@link LanguageTreeResult} into a list of {@link Diagnostic}s:
 * header failures first, then the failures of the body in source order, including statements
 * that failed inside lambda blocks.
 */
public class DiagnosticsCollector {

	private final LanguageFeatureCatalog catalog;

	public DiagnosticsCollector(LanguageFeatureCatalog catalog) {
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
	}

	public List<Diagnostic> collect(LanguageTreeResult result) {
		Objects.requireNonNull(result, "result must not be null");
		List<Diagnostic> diagnostics = new ArrayList<>();

		for (LanguageResult<Import> header : result.imports()) {
			addFailures(header, diagnostics);
		}

		LanguageResult<Block> topLevelBlock = result.topLevelBlock();
		if (topLevelBlock instanceof Element<Block> block) {
			LanguageTreeWalker.walkPreOrder(block.element(), element -> {
				if (element instanceof ErroneousStatement erroneous) {
					addFailures(erroneous.failingResult(), diagnostics);
				}
			});
		} else {
			addFailures(topLevelBlock, diagnostics);
		}
		return diagnostics;
	}

	private <T> void addFailures(LanguageResult<T> result, List<Diagnostic> diagnostics) {
		result.accept(new LanguageResultVisitor<T, Void>() {
			@Override
			public Void visitElement(Element<T> element) {
				return null;
			}

			@Override
			public Void visitParsingError(ParsingError<T> parsingError) {
				diagnostics.add(new Diagnostic(Diagnostic.Kind.PARSING_ERROR, parsingError.message(), null, null,
						parsingError.potentialElementSource(), parsingError.erroneousSource()));
				return null;
			}

			@Override
			public Void visitUnsupportedConstruct(UnsupportedConstruct<T> unsupportedConstruct) {
				FeatureGuidance guidance = catalog.guidanceFor(unsupportedConstruct.languageFeature());
				diagnostics.add(new Diagnostic(Diagnostic.Kind.UNSUPPORTED_CONSTRUCT, guidance.message(),
						unsupportedConstruct.languageFeature(), guidance.hint(),
						unsupportedConstruct.potentialElementSource(), unsupportedConstruct.erroneousSource()));
				return null;
			}

			@Override
			public Void visitMultipleFailures(MultipleFailuresResult<T> multipleFailures) {
				for (FailingResult<?> failure : multipleFailures.failures()) {
					addFailures(failure, diagnostics);
				}
				return null;
			}
		});
	}
}
