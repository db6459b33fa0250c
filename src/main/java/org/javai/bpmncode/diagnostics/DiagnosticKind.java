package org.javai.bpmncode.diagnostics;

/**
 * Category of a {@link Diagnostic}. Parser, recovery, context and semantic diagnostics all share
 * this one set.
 */
public enum DiagnosticKind {
	SYNTAX_ERROR,
	UNEXPECTED_TOKEN,
	UNCLOSED_BLOCK,
	INVALID_ATTRIBUTE_VALUE,
	DUPLICATE_ID,
	UNDEFINED_REFERENCE,
	INVALID_FLOW,
	UNEXPECTED_EOF,
	MISSING_ELEMENT,
	UNKNOWN_ATTRIBUTE
}
