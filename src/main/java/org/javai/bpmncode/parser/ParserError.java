package org.javai.bpmncode.parser;

import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.javai.bpmncode.diagnostics.Diagnostic;
import org.javai.bpmncode.diagnostics.DiagnosticKind;
import org.javai.bpmncode.diagnostics.Severity;
import org.javai.bpmncode.diagnostics.SuggestionEngine;
import org.javai.bpmncode.lexer.Span;
import org.javai.bpmncode.lexer.Token;
import org.javai.bpmncode.lexer.TokenKind;

/**
 * Why a grammar rule failed.
 *
 * @param kind one of {@link DiagnosticKind#UNEXPECTED_TOKEN},
 * {@link DiagnosticKind#UNEXPECTED_EOF} or {@link DiagnosticKind#INVALID_ATTRIBUTE_VALUE}
 * @param found source text of the offending token
 * @param expected what the rule wanted, e.g. {@code "identifier"}; {@code null} for invalid values
 * @param span where the offending token is
 */
public record ParserError(DiagnosticKind kind, String found, String expected, Span span) {

	static final String EXPECTED_EVENT_TYPE = "event type (message, timer, error, signal, terminate)";
	static final String EXPECTED_FLOW_ARROW = "flow arrow (-> --> => ..>)";

	public static ParserError unexpectedToken(Token found, String expected) {
		if (found.isKind(TokenKind.EOF)) {
			return new ParserError(DiagnosticKind.UNEXPECTED_EOF, "", expected, found.span());
		}
		return new ParserError(DiagnosticKind.UNEXPECTED_TOKEN, found.text(), expected, found.span());
	}

	public static ParserError expected(Token found, TokenKind expected) {
		return unexpectedToken(found, expected.describe());
	}

	public static ParserError invalidAttributeValue(Token value) {
		return new ParserError(DiagnosticKind.INVALID_ATTRIBUTE_VALUE, value.text(), null, value.span());
	}

	public String message() {
		return switch (kind) {
			case UNEXPECTED_EOF -> "Unexpected end of input, expected " + expected;
			case INVALID_ATTRIBUTE_VALUE -> "Invalid attribute value '" + found + "'";
			default -> "Unexpected token '" + found + "', expected " + expected;
		};
	}

	/**
	 * Converts this error into a diagnostic, adding "did you mean" candidates that fit what the
	 * rule expected: event types after {@code @} in event position, arrows where a flow operator
	 * was due, keywords otherwise.
	 */
	public Diagnostic toDiagnostic(Severity severity, SuggestionEngine suggestions) {
		return new Diagnostic(kind, message(), span, severity, suggestionsFor(suggestions));
	}

	private List<String> suggestionsFor(SuggestionEngine suggestions) {
		if (kind != DiagnosticKind.UNEXPECTED_TOKEN || suggestions == null || StringUtils.isBlank(found)) {
			return List.of();
		}
		List<String> candidates;
		if (EXPECTED_EVENT_TYPE.equals(expected)) {
			candidates = suggestions.suggestEventTypes(found);
		} else if (EXPECTED_FLOW_ARROW.equals(expected)) {
			candidates = suggestions.suggestFlowOperators(found);
		} else {
			candidates = suggestions.suggestKeywords(found);
		}
		return candidates.stream().filter(candidate -> !candidate.equals(found)).toList();
	}

	@Override
	public String toString() {
		return message() + " at " + span;
	}
}
