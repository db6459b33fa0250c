package org.javai.bpmncode.lexer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tokenizer for BPMNCode source text.
 * <p>
 * Tokenizing is a total function: characters that match no rule become {@link TokenKind#UNKNOWN}
 * tokens and are reported later by the validators. Newlines and comments are kept as tokens
 * because later stages use them as statement boundaries. The token list always ends with a
 * single {@link TokenKind#EOF} token whose span collapses to the end of the input.
 */
public class BpmnTokenizer {

	private final String input;
	private final Path file;
	private int pos = 0;

	// Incremental line/column scan; offsets only ever move forward.
	private int scannedTo = 0;
	private int line = 1;
	private int column = 1;

	public BpmnTokenizer(String input, Path file) {
		this.input = input != null ? input : "";
		this.file = file != null ? file : Span.UNKNOWN_FILE;
	}

	public BpmnTokenizer(String input) {
		this(input, null);
	}

	/**
	 * Tokenizes {@code sourceText} read from {@code filePath}.
	 */
	public static List<Token> tokenize(String sourceText, Path filePath) {
		return new BpmnTokenizer(sourceText, filePath).tokenize();
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return an unmodifiable token list ending with EOF
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<>();

		while (true) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new Token(TokenKind.EOF, "", spanOf(input.length(), input.length())));
		return Collections.unmodifiableList(tokens);
	}

	private Token nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '\n' -> single(TokenKind.NEWLINE);
			case '\r' -> lookingAt("\r\n") ? fixed(TokenKind.CARRIAGE_RETURN_NEWLINE) : unknown();
			case '{' -> single(TokenKind.LEFT_BRACE);
			case '}' -> single(TokenKind.RIGHT_BRACE);
			case '(' -> single(TokenKind.LEFT_PAREN);
			case ')' -> single(TokenKind.RIGHT_PAREN);
			case '[' -> single(TokenKind.LEFT_BRACKET);
			case ']' -> single(TokenKind.RIGHT_BRACKET);
			case ',' -> single(TokenKind.COMMA);
			case '@' -> single(TokenKind.AT);
			case '?' -> single(TokenKind.QUESTION);
			case '-' -> {
				if (lookingAt("-->")) {
					yield fixed(TokenKind.MESSAGE_FLOW);
				} else if (lookingAt("->")) {
					yield fixed(TokenKind.SEQUENCE_FLOW);
				}
				yield unknown();
			}
			case '=' -> lookingAt("=>") ? fixed(TokenKind.DEFAULT_FLOW) : single(TokenKind.EQUALS);
			case '.' -> lookingAt("..>") ? fixed(TokenKind.ASSOCIATION) : unknown();
			case ':' -> lookingAt("::") ? fixed(TokenKind.NAMESPACE) : unknown();
			case '/' -> {
				if (lookingAt("//")) {
					yield scanLineComment();
				} else if (lookingAt("/*")) {
					yield scanBlockComment();
				}
				yield unknown();
			}
			case '"' -> scanString();
			default -> {
				if (isDigit(c)) {
					yield scanNumber();
				} else if (isIdentifierStart(c)) {
					yield scanIdentifier();
				}
				yield unknownAt(start);
			}
		};
	}

	private Token scanString() {
		int start = pos;
		int cursor = pos + 1;

		while (cursor < input.length()) {
			char c = input.charAt(cursor);
			if (c == '"') {
				pos = cursor + 1;
				return token(TokenKind.STRING_LITERAL, start);
			}
			if (c == '\\') {
				// An escape may not swallow a line break
				if (cursor + 1 >= input.length() || input.charAt(cursor + 1) == '\n') {
					break;
				}
				cursor += 2;
			} else {
				cursor++;
			}
		}

		// Unterminated: only the quote itself is unrecognized
		return unknown();
	}

	private Token scanNumber() {
		int start = pos;

		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}

		if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
			advance();
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		// Unit suffix such as 30s or 500ms
		while (!isAtEnd() && isLetter(peek())) {
			advance();
		}

		return token(TokenKind.NUMBER_LITERAL, start);
	}

	private Token scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		TokenKind kind = TokenKind.keyword(value).orElse(TokenKind.IDENTIFIER);
		return new Token(kind, value, spanOf(start, pos));
	}

	private Token scanLineComment() {
		int start = pos;
		while (!isAtEnd() && peek() != '\n') {
			advance();
		}
		return token(TokenKind.LINE_COMMENT, start);
	}

	private Token scanBlockComment() {
		int start = pos;
		int close = input.indexOf("*/", pos + 2);
		if (close < 0) {
			return unknown();
		}
		pos = close + 2;
		return token(TokenKind.BLOCK_COMMENT, start);
	}

	private Token single(TokenKind kind) {
		int start = pos;
		advance();
		return token(kind, start);
	}

	private Token fixed(TokenKind kind) {
		int start = pos;
		pos += kind == TokenKind.CARRIAGE_RETURN_NEWLINE ? 2 : kind.lexeme().length();
		return token(kind, start);
	}

	private Token unknown() {
		return unknownAt(pos);
	}

	private Token unknownAt(int start) {
		pos = start + Character.charCount(input.codePointAt(start));
		return token(TokenKind.UNKNOWN, start);
	}

	private Token token(TokenKind kind, int start) {
		return new Token(kind, input.substring(start, pos), spanOf(start, pos));
	}

	private Span spanOf(int start, int end) {
		while (scannedTo < start) {
			char ch = input.charAt(scannedTo);
			if (ch == '\n') {
				line++;
				column = 1;
			} else if (!Character.isLowSurrogate(ch)) {
				column++;
			}
			scannedTo++;
		}
		return new Span(start, end, line, column, file);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private boolean lookingAt(String text) {
		return input.startsWith(text, pos);
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\f';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private boolean isIdentifierStart(char c) {
		return isLetter(c) || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
