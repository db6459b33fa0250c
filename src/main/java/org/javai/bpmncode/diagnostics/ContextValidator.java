package org.javai.bpmncode.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.javai.bpmncode.ast.EventType;
import org.javai.bpmncode.lexer.Span;
import org.javai.bpmncode.lexer.Token;
import org.javai.bpmncode.lexer.TokenKind;

/**
 * Heuristic checks over the raw token list, run before parsing.
 * <p>
 * Catches what the parser can only report vaguely: misspelled keywords at the start of a
 * statement, stray characters, broken arrows ({@code A - B}) and gateways whose braces are
 * missing. The checks are tuned to keep false positives low, so a clean result does not mean
 * the source parses. Diagnostics are purely additive; nothing here blocks parsing.
 */
public class ContextValidator {

	private static final Set<String> OPERATOR_FRAGMENTS = Set.of("<", ">", "=", "!", "&", "|");

	private static final Set<TokenKind> ELEMENT_KEYWORDS = Set.of(
			TokenKind.XOR, TokenKind.AND, TokenKind.TASK, TokenKind.USER,
			TokenKind.SERVICE, TokenKind.SCRIPT, TokenKind.END);

	private final SuggestionEngine suggestions;

	public ContextValidator(SuggestionEngine suggestions) {
		if (suggestions == null) {
			throw new IllegalArgumentException("SuggestionEngine cannot be null");
		}
		this.suggestions = suggestions;
	}

	public ContextValidator() {
		this(SuggestionEngine.withDefaults());
	}

	/**
	 * Runs every check over {@code tokens}.
	 *
	 * @return diagnostics in check order; empty when nothing looks suspicious
	 */
	public List<Diagnostic> validateContext(List<Token> tokens) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		if (tokens == null || tokens.isEmpty()) {
			return diagnostics;
		}

		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			switch (token.kind()) {
				case IDENTIFIER -> checkIdentifierTypo(tokens, i, diagnostics);
				case UNKNOWN -> checkUnknownToken(token, diagnostics);
				case AT -> checkAttributeName(tokens, i + 1, diagnostics);
				case EQUALS -> checkParenthesizedAttributeName(tokens, i, diagnostics);
				default -> {
				}
			}
		}

		checkFlowSyntax(tokens, diagnostics);
		checkGatewayBraces(tokens, diagnostics);

		return diagnostics;
	}

	private void checkIdentifierTypo(List<Token> tokens, int index, List<Diagnostic> diagnostics) {
		if (isContextualIdentifier(tokens, index) || !isStatementStart(tokens, index)) {
			return;
		}

		Token token = tokens.get(index);
		String identifier = token.text();
		Optional<String> keyword = suggestions.detectKeywordTypo(identifier);
		if (keyword.isPresent()) {
			diagnostics.add(new Diagnostic(
					DiagnosticKind.UNEXPECTED_TOKEN,
					"Unexpected token '" + identifier + "', expected keyword (did you mean '" + keyword.get() + "'?)",
					token.span(),
					Severity.ERROR,
					List.of(keyword.get())));
		} else if (suggestions.isLikelyKeywordTypo(identifier)) {
			diagnostics.add(new Diagnostic(
					DiagnosticKind.UNEXPECTED_TOKEN,
					"Unexpected token '" + identifier + "', expected BPMN keyword",
					token.span(),
					Severity.ERROR,
					suggestions.suggestKeywords(identifier)));
		}
	}

	private void checkUnknownToken(Token token, List<Diagnostic> diagnostics) {
		// Fragments of operators such as == or && are left to the condition text
		if (OPERATOR_FRAGMENTS.contains(token.text())) {
			return;
		}
		diagnostics.add(Diagnostic.error(DiagnosticKind.SYNTAX_ERROR, "Unknown token '" + token.text() + "'",
				token.span()));
	}

	private void checkAttributeName(List<Token> tokens, int nameIndex, List<Diagnostic> diagnostics) {
		if (nameIndex >= tokens.size() || !tokens.get(nameIndex).isKind(TokenKind.IDENTIFIER)) {
			return;
		}
		Token name = tokens.get(nameIndex);
		if (EventType.TYPE_NAMES.contains(name.text())) {
			return;
		}
		hintUnknownAttribute(name, diagnostics);
	}

	private void checkParenthesizedAttributeName(List<Token> tokens, int equalsIndex, List<Diagnostic> diagnostics) {
		if (equalsIndex < 2) {
			return;
		}
		Token name = tokens.get(equalsIndex - 1);
		TokenKind before = tokens.get(equalsIndex - 2).kind();
		if (name.isKind(TokenKind.IDENTIFIER)
				&& (before == TokenKind.LEFT_PAREN || before == TokenKind.COMMA || before.isNewline())) {
			hintUnknownAttribute(name, diagnostics);
		}
	}

	private void hintUnknownAttribute(Token name, List<Diagnostic> diagnostics) {
		List<String> known = suggestions.settings().attributeNames();
		if (known.contains(name.text())) {
			return;
		}
		List<String> close = suggestions.suggestAttributes(name.text()).stream()
				.filter(candidate -> suggestions.score(name.text(), candidate)
						> suggestions.settings().keywordTypoThreshold())
				.toList();
		if (!close.isEmpty()) {
			diagnostics.add(new Diagnostic(
					DiagnosticKind.UNKNOWN_ATTRIBUTE,
					"Attribute '" + name.text() + "' is not a known attribute name",
					name.span(),
					Severity.HINT,
					close));
		}
	}

	private void checkFlowSyntax(List<Token> tokens, List<Diagnostic> diagnostics) {
		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			if (!"-".equals(token.text())) {
				continue;
			}
			if (i + 1 < tokens.size() && ">".equals(tokens.get(i + 1).text())) {
				continue;
			}
			if (looksLikeFlowContext(tokens, i)) {
				diagnostics.add(new Diagnostic(
						DiagnosticKind.INVALID_FLOW,
						"Invalid flow operator: use '->' for sequence flow",
						token.span(),
						Severity.ERROR,
						List.of("->")));
			}
		}
	}

	private void checkGatewayBraces(List<Token> tokens, List<Diagnostic> diagnostics) {
		for (int i = 0; i < tokens.size(); i++) {
			TokenKind kind = tokens.get(i).kind();
			if (kind == TokenKind.XOR || kind == TokenKind.AND) {
				checkGatewayBraces(tokens, i, diagnostics);
			}
		}
	}

	private void checkGatewayBraces(List<Token> tokens, int gatewayIndex, List<Diagnostic> diagnostics) {
		Token gateway = tokens.get(gatewayIndex);
		String gatewayType = gateway.isKind(TokenKind.XOR) ? "XOR" : "AND";

		int j = gatewayIndex + 1;
		Span gatewaySpan = gateway.span();
		if (j < tokens.size() && tokens.get(j).isKind(TokenKind.IDENTIFIER)) {
			gatewaySpan = gatewaySpan.through(tokens.get(j).span());
			j++;
		}
		if (j < tokens.size() && tokens.get(j).isKind(TokenKind.QUESTION)) {
			gatewaySpan = gatewaySpan.through(tokens.get(j).span());
			j++;
		}

		int next = nextSignificant(tokens, j);
		if (next >= 0 && tokens.get(next).isKind(TokenKind.LEFT_BRACE)) {
			if (!hasGatewayClosingBrace(tokens, next)) {
				diagnostics.add(new Diagnostic(
						DiagnosticKind.SYNTAX_ERROR,
						gatewayType + " gateway missing closing brace '}'",
						gatewaySpan,
						Severity.ERROR,
						List.of("}")));
			}
		} else if (hasGatewayConditionsAhead(tokens, j)) {
			diagnostics.add(new Diagnostic(
					DiagnosticKind.SYNTAX_ERROR,
					gatewayType + " gateway missing opening brace '{' before conditions",
					gatewaySpan,
					Severity.ERROR,
					List.of("{")));
		}
	}

	private int nextSignificant(List<Token> tokens, int start) {
		for (int i = start; i < tokens.size(); i++) {
			if (!tokens.get(i).isTrivia()) {
				return i;
			}
		}
		return -1;
	}

	private boolean hasGatewayConditionsAhead(List<Token> tokens, int start) {
		int seen = 0;
		for (int i = start; i < tokens.size() && seen < suggestions.settings().gatewayLookahead(); i++) {
			Token token = tokens.get(i);
			if (token.isTrivia()) {
				continue;
			}
			seen++;
			switch (token.kind()) {
				case LEFT_BRACKET, DEFAULT_FLOW -> {
					return true;
				}
				case RIGHT_BRACE -> {
					return false;
				}
				default -> {
				}
			}
		}
		return false;
	}

	/**
	 * Scans a gateway block for its closing brace. An element keyword at the block's own depth
	 * means the block ran into the following statements, so the brace is missing. A block that
	 * closes without any branch syntax is not judged.
	 */
	private boolean hasGatewayClosingBrace(List<Token> tokens, int openIndex) {
		int depth = 1;
		for (int i = openIndex + 1; i < tokens.size(); i++) {
			TokenKind kind = tokens.get(i).kind();
			switch (kind) {
				case LEFT_BRACE -> depth++;
				case RIGHT_BRACE -> {
					depth--;
					if (depth == 0) {
						return true;
					}
				}
				default -> {
					if (depth == 1 && ELEMENT_KEYWORDS.contains(kind)) {
						return false;
					}
				}
			}
		}
		return false;
	}

	private boolean isContextualIdentifier(List<Token> tokens, int index) {
		if (index + 1 < tokens.size()) {
			Token next = tokens.get(index + 1);
			if (next.isKind(TokenKind.LEFT_PAREN) || next.kind().isFlowOperator() || "-".equals(next.text())) {
				return true;
			}
		}
		return index > 0 && tokens.get(index - 1).kind().isFlowOperator();
	}

	/**
	 * An identifier starts a statement when only identifiers and literals separate it from a
	 * preceding brace or newline.
	 */
	private boolean isStatementStart(List<Token> tokens, int index) {
		if (index == 0) {
			return true;
		}
		for (int i = index - 1; i >= 0; i--) {
			TokenKind kind = tokens.get(i).kind();
			if (kind == TokenKind.LEFT_BRACE || kind == TokenKind.RIGHT_BRACE || kind.isNewline()) {
				return true;
			}
			if (kind != TokenKind.IDENTIFIER && kind != TokenKind.STRING_LITERAL && kind != TokenKind.NUMBER_LITERAL) {
				return false;
			}
		}
		return false;
	}

	private boolean looksLikeFlowContext(List<Token> tokens, int index) {
		return index > 0 && index + 1 < tokens.size()
				&& tokens.get(index - 1).isKind(TokenKind.IDENTIFIER)
				&& tokens.get(index + 1).isKind(TokenKind.IDENTIFIER);
	}
}
