package org.javai.bpmncode.ast;

import java.util.List;
import org.javai.bpmncode.diagnostics.Diagnostic;
import org.javai.bpmncode.diagnostics.Severity;

/**
 * Result of parsing one source file. Always produced, even for empty or garbage input; the
 * parse diagnostics are carried alongside the best-effort tree.
 */
public record Document(List<ImportDeclaration> imports, List<ProcessDeclaration> processes,
		List<Diagnostic> errors) {

	public Document {
		imports = List.copyOf(imports);
		processes = List.copyOf(processes);
		errors = List.copyOf(errors);
	}

	public static Document empty() {
		return new Document(List.of(), List.of(), List.of());
	}

	/**
	 * Whether any parse diagnostic has error severity; warnings alone do not count.
	 */
	public boolean hasErrors() {
		return errors.stream().anyMatch(d -> d.severity() == Severity.ERROR);
	}
}
