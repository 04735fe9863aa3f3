package org.javai.buildscript.tree;

import java.util.Objects;
import org.javai.buildscript.language.Block;
import org.javai.buildscript.language.Element;
import org.javai.buildscript.language.ErroneousStatement;
import org.javai.buildscript.language.FailingResult;
import org.javai.buildscript.language.LanguageTreeResult;
import org.javai.buildscript.language.SourceIdentifier;
import org.javai.buildscript.language.SourceText;
import org.javai.buildscript.syntax.AstNode;
import org.javai.buildscript.syntax.LightTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless {@link LanguageTreeBuilder}; one instance can be shared between threads.
 */
public class DefaultLanguageTreeBuilder implements LanguageTreeBuilder {

	private static final Logger logger = LoggerFactory.getLogger(DefaultLanguageTreeBuilder.class);

	@Override
	public LanguageTreeResult build(AstNode syntaxTree, SourceIdentifier sourceIdentifier) {
		Objects.requireNonNull(syntaxTree, "syntaxTree must not be null");
		Objects.requireNonNull(sourceIdentifier, "sourceIdentifier must not be null");

		SourceText source = SourceText.of(sourceIdentifier, syntaxTree.text());
		LanguageTreeResult result = new GrammarToTree(source).build(AstSyntaxElement.root(syntaxTree));
		logSummary("full tree", sourceIdentifier, result);
		return result;
	}

	@Override
	public LanguageTreeResult build(LightTree lightTree, String sourceText, int sourceOffset,
			SourceIdentifier sourceIdentifier) {
		Objects.requireNonNull(lightTree, "lightTree must not be null");
		Objects.requireNonNull(sourceText, "sourceText must not be null");
		Objects.requireNonNull(sourceIdentifier, "sourceIdentifier must not be null");
		if (sourceOffset < 0 || sourceOffset > sourceText.length()) {
			throw new IllegalArgumentException(
					"Source offset " + sourceOffset + " is outside of a text of length " + sourceText.length());
		}

		SourceText source = SourceText.embedded(sourceIdentifier, sourceText, sourceOffset);
		LanguageTreeResult result = new GrammarToTree(source)
				.build(LightSyntaxElement.root(lightTree, sourceText, sourceOffset));
		logSummary("light tree", sourceIdentifier, result);
		return result;
	}

	private void logSummary(String adapter, SourceIdentifier sourceIdentifier, LanguageTreeResult result) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		long failedImports = result.imports().stream()
				.filter(FailingResult.class::isInstance)
				.count();
		int statements = 0;
		long failedStatements = 0;
		if (result.topLevelBlock() instanceof Element<Block> block) {
			statements = block.element().content().size();
			failedStatements = block.element().content().stream()
					.filter(ErroneousStatement.class::isInstance)
					.count();
		}
		logger.debug("Built language tree of {} from {}: {} header entries ({} failed), {} statements ({} failed)",
				sourceIdentifier, adapter, result.imports().size(), failedImports, statements, failedStatements);
	}
}
