package org.javai.buildscript.diagnostics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.buildscript.language.SourceData;
import org.javai.buildscript.language.SourceIdentifier;

/**
 * Emits diagnostics as JSON for editors and other tooling. Positions are those of the
 * erroneous source; lines and columns are 1-based, the end is exclusive.
 */
public final class DiagnosticsJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private DiagnosticsJsonEmitter() {}

	public static ObjectNode emit(SourceIdentifier sourceIdentifier, List<Diagnostic> diagnostics) {
		ObjectNode root = mapper.createObjectNode();
		root.put("source", sourceIdentifier.fileIdentifier());

		ArrayNode entries = root.putArray("diagnostics");
		diagnostics.forEach(diagnostic -> {
			ObjectNode d = entries.addObject();
			d.put("kind", diagnostic.kind().name());
			d.put("message", diagnostic.message());
			if (diagnostic.feature() != null) {
				d.put("feature", diagnostic.feature().name());
			}
			if (diagnostic.hint() != null) {
				d.put("hint", diagnostic.hint());
			}
			SourceData source = diagnostic.erroneousSource();
			d.put("line", source.startLine());
			d.put("column", source.startColumn());
			d.put("endLine", source.endLine());
			d.put("endColumn", source.endColumn());
			d.put("startOffset", source.startOffset());
			d.put("endOffset", source.endOffset());
		});

		return root;
	}

	/**
	 * The emitted JSON as indented text.
	 */
	public static String render(SourceIdentifier sourceIdentifier, List<Diagnostic> diagnostics) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(emit(sourceIdentifier, diagnostics));
		} catch (Exception e) {
			throw new IllegalStateException("Failed to render diagnostics of " + sourceIdentifier, e);
		}
	}
}
