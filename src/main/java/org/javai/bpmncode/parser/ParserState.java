package org.javai.bpmncode.parser;

import java.util.ArrayList;
import java.util.List;
import org.javai.bpmncode.diagnostics.Diagnostic;
import org.javai.bpmncode.lexer.Span;
import org.javai.bpmncode.lexer.Token;
import org.javai.bpmncode.lexer.TokenKind;

/**
 * Cursor over a token list plus the diagnostics recorded so far, for one parse.
 * <p>
 * Trivia is not skipped implicitly: newlines end element statements, so callers skip trivia
 * only where the grammar allows a line break.
 */
public class ParserState {

	private final List<Token> tokens;
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private int current = 0;
	private int depth = 0;

	public ParserState(List<Token> tokens) {
		List<Token> source = tokens != null ? tokens : List.of();
		if (source.isEmpty() || !source.get(source.size() - 1).isKind(TokenKind.EOF)) {
			List<Token> terminated = new ArrayList<>(source);
			int end = source.isEmpty() ? 0 : source.get(source.size() - 1).span().end();
			Span last = source.isEmpty() ? new Span(0, 0, 1, 1, null) : source.get(source.size() - 1).span();
			terminated.add(new Token(TokenKind.EOF, "", new Span(end, end, last.line(), last.column(), last.file())));
			source = terminated;
		}
		this.tokens = List.copyOf(source);
	}

	public List<Token> tokens() {
		return tokens;
	}

	public Token peek() {
		return tokens.get(current);
	}

	public Token advance() {
		Token token = tokens.get(current);
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	public boolean check(TokenKind kind) {
		return peek().kind() == kind;
	}

	/**
	 * Consumes the current token if it has the given kind.
	 */
	public boolean match(TokenKind kind) {
		if (check(kind)) {
			advance();
			return true;
		}
		return false;
	}

	public boolean isAtEnd() {
		return peek().isKind(TokenKind.EOF);
	}

	public void skipTrivia() {
		while (peek().isTrivia()) {
			current++;
		}
	}

	public int position() {
		return current;
	}

	/**
	 * Moves the cursor to an absolute token index, clamped to the EOF token.
	 */
	public void seek(int position) {
		current = Math.max(0, Math.min(position, tokens.size() - 1));
	}

	public Snapshot mark() {
		return new Snapshot(current, diagnostics.size());
	}

	/**
	 * Restores the cursor and drops every diagnostic recorded since {@code snapshot}.
	 */
	public void reset(Snapshot snapshot) {
		current = snapshot.position();
		diagnostics.subList(snapshot.diagnosticCount(), diagnostics.size()).clear();
	}

	public void report(Diagnostic diagnostic) {
		diagnostics.add(diagnostic);
	}

	public void reportAll(List<Diagnostic> additional) {
		diagnostics.addAll(additional);
	}

	public List<Diagnostic> diagnostics() {
		return diagnostics;
	}

	public int depth() {
		return depth;
	}

	public void enterContainer() {
		depth++;
	}

	public void exitContainer() {
		depth--;
	}

	/**
	 * A saved cursor position and diagnostic count.
	 */
	public record Snapshot(int position, int diagnosticCount) {
	}
}
