package org.javai.buildscript.language;

import java.util.List;
import java.util.Objects;

/**
 * Everything built from one source unit: the header results (package directive and imports, in
 * source order) and the top-level block.
 */
public record LanguageTreeResult(List<LanguageResult<Import>> imports, LanguageResult<Block> topLevelBlock) {

	public LanguageTreeResult {
		imports = List.copyOf(imports);
		Objects.requireNonNull(topLevelBlock, "topLevelBlock must not be null");
	}

	/**
	 * The successfully built imports.
	 */
	public List<Import> successfulImports() {
		return imports.stream()
				.filter(result -> result instanceof Element<Import>)
				.map(result -> ((Element<Import>) result).element())
				.toList();
	}
}
