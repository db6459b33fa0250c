package org.javai.bpmncode.lexer;

/**
 * A token of BPMNCode source.
 *
 * @param kind the token kind
 * @param text the exact source slice (empty for EOF)
 * @param span where the token sits in the source
 */
public record Token(TokenKind kind, String text, Span span) {

	@Override
	public String toString() {
		return switch (kind) {
			case STRING_LITERAL, NUMBER_LITERAL, IDENTIFIER, UNKNOWN -> kind + "(" + text + ")";
			default -> kind.toString();
		};
	}

	public boolean isKind(TokenKind expected) {
		return kind == expected;
	}

	public boolean isIdentifier(String expected) {
		return kind == TokenKind.IDENTIFIER && text.equals(expected);
	}

	public boolean isTrivia() {
		return kind.isTrivia();
	}
}
