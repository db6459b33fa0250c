package org.javai.bpmncode.diagnostics;

import java.util.List;
import java.util.Objects;
import org.javai.bpmncode.lexer.Span;

/**
 * A single finding reported against BPMNCode source.
 *
 * @param kind the category
 * @param message human-readable description
 * @param span where in the source the problem is
 * @param severity how serious it is; only {@link Severity#ERROR} fails a check
 * @param suggestions ranked replacement candidates, possibly empty
 */
public record Diagnostic(DiagnosticKind kind, String message, Span span, Severity severity, List<String> suggestions) {

	public Diagnostic {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(message, "message must not be null");
		Objects.requireNonNull(span, "span must not be null");
		Objects.requireNonNull(severity, "severity must not be null");
		suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
	}

	public static Diagnostic error(DiagnosticKind kind, String message, Span span) {
		return new Diagnostic(kind, message, span, Severity.ERROR, List.of());
	}

	public static Diagnostic warning(DiagnosticKind kind, String message, Span span) {
		return new Diagnostic(kind, message, span, Severity.WARNING, List.of());
	}

	public boolean isError() {
		return severity.isError();
	}

	@Override
	public String toString() {
		String help = suggestions.isEmpty() ? "" : " (did you mean: " + String.join(", ", suggestions) + "?)";
		return severity.label() + " at " + span + ": " + message + help;
	}
}
