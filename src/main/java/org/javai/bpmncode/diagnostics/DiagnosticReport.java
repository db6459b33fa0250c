package org.javai.bpmncode.diagnostics;

import java.nio.file.Path;
import java.util.List;

/**
 * All diagnostics produced for one input file, in pipeline order: context validation, then
 * parsing and recovery, then semantic validation.
 */
public record DiagnosticReport(Path file, List<Diagnostic> diagnostics) {

	public DiagnosticReport {
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public long errorCount() {
		return count(Severity.ERROR);
	}

	public long warningCount() {
		return count(Severity.WARNING);
	}

	public long count(Severity severity) {
		return diagnostics.stream().filter(d -> d.severity() == severity).count();
	}

	public List<Diagnostic> bySeverity(Severity severity) {
		return diagnostics.stream().filter(d -> d.severity() == severity).toList();
	}
}
