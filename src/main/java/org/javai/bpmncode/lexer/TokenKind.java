package org.javai.bpmncode.lexer;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Every kind of token the BPMNCode tokenizer can produce.
 */
public enum TokenKind {

	// Keywords
	PROCESS("process"),
	IMPORT("import"),
	FROM("from"),
	AS("as"),
	SUBPROCESS("subprocess"),
	START("start"),
	END("end"),
	TASK("task"),
	USER("user"),
	SERVICE("service"),
	SCRIPT("script"),
	CALL("call"),
	XOR("xor"),
	AND("and"),
	EVENT("event"),
	GROUP("group"),
	POOL("pool"),
	LANE("lane"),
	NOTE("note"),

	// Flow operators
	SEQUENCE_FLOW("->"),
	MESSAGE_FLOW("-->"),
	DEFAULT_FLOW("=>"),
	ASSOCIATION("..>"),
	NAMESPACE("::"),

	// Punctuation
	LEFT_BRACE("{"),
	RIGHT_BRACE("}"),
	LEFT_PAREN("("),
	RIGHT_PAREN(")"),
	LEFT_BRACKET("["),
	RIGHT_BRACKET("]"),
	COMMA(","),
	EQUALS("="),
	AT("@"),
	QUESTION("?"),

	// Literals
	STRING_LITERAL(null),
	NUMBER_LITERAL(null),
	IDENTIFIER(null),

	// Trivia kept as real tokens
	LINE_COMMENT(null),
	BLOCK_COMMENT(null),
	NEWLINE(null),
	CARRIAGE_RETURN_NEWLINE(null),

	UNKNOWN(null),
	EOF(null);

	private static final Set<TokenKind> KEYWORDS = Collections.unmodifiableSet(EnumSet.range(PROCESS, NOTE));
	private static final Set<TokenKind> FLOW_OPERATORS = Collections.unmodifiableSet(
			EnumSet.of(SEQUENCE_FLOW, MESSAGE_FLOW, DEFAULT_FLOW, ASSOCIATION));
	private static final Set<TokenKind> TRIVIA = Collections.unmodifiableSet(
			EnumSet.of(LINE_COMMENT, BLOCK_COMMENT, NEWLINE, CARRIAGE_RETURN_NEWLINE));
	private static final Map<String, TokenKind> KEYWORD_LOOKUP = new HashMap<>();

	static {
		for (TokenKind kind : KEYWORDS) {
			KEYWORD_LOOKUP.put(kind.lexeme, kind);
		}
	}

	private final String lexeme;

	TokenKind(String lexeme) {
		this.lexeme = lexeme;
	}

	/**
	 * The fixed source text of this kind, or {@code null} for literals, trivia, unknown and EOF.
	 */
	public String lexeme() {
		return lexeme;
	}

	public boolean isKeyword() {
		return KEYWORDS.contains(this);
	}

	public boolean isFlowOperator() {
		return FLOW_OPERATORS.contains(this);
	}

	/**
	 * Newlines and comments. The parser skips them between statements; the context validator
	 * uses newlines as statement boundaries.
	 */
	public boolean isTrivia() {
		return TRIVIA.contains(this);
	}

	public boolean isNewline() {
		return this == NEWLINE || this == CARRIAGE_RETURN_NEWLINE;
	}

	public static Optional<TokenKind> keyword(String word) {
		return Optional.ofNullable(KEYWORD_LOOKUP.get(word));
	}

	public static Set<TokenKind> keywords() {
		return KEYWORDS;
	}

	/**
	 * Human-readable form used in "expected ..." messages.
	 */
	public String describe() {
		return switch (this) {
			case STRING_LITERAL -> "string";
			case NUMBER_LITERAL -> "number";
			case IDENTIFIER -> "identifier";
			case LINE_COMMENT, BLOCK_COMMENT -> "comment";
			case NEWLINE, CARRIAGE_RETURN_NEWLINE -> "newline";
			case UNKNOWN -> "unknown token";
			case EOF -> "end of input";
			default -> "'" + lexeme + "'";
		};
	}
}
