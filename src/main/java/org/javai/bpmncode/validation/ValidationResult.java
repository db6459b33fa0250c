package org.javai.bpmncode.validation;

import java.util.List;
import org.javai.bpmncode.diagnostics.Diagnostic;

/**
 * Outcome of semantic validation: success when nothing was found, otherwise every diagnostic
 * in discovery order. Warnings alone also make the result unsuccessful.
 */
public record ValidationResult(List<Diagnostic> diagnostics) {

	private static final ValidationResult SUCCESS = new ValidationResult(List.of());

	public ValidationResult {
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	public static ValidationResult of(List<Diagnostic> diagnostics) {
		return diagnostics == null || diagnostics.isEmpty() ? SUCCESS : new ValidationResult(diagnostics);
	}

	public boolean isSuccess() {
		return diagnostics.isEmpty();
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}
}
