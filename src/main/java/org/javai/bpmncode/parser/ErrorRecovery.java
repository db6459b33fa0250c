package org.javai.bpmncode.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.bpmncode.ast.Flow;
import org.javai.bpmncode.ast.FlowType;
import org.javai.bpmncode.ast.GatewayBranch;
import org.javai.bpmncode.ast.GatewayType;
import org.javai.bpmncode.ast.ProcessElement;
import org.javai.bpmncode.ast.TaskType;
import org.javai.bpmncode.config.CheckerSettings;
import org.javai.bpmncode.diagnostics.Diagnostic;
import org.javai.bpmncode.diagnostics.DiagnosticKind;
import org.javai.bpmncode.lexer.Span;
import org.javai.bpmncode.lexer.Token;
import org.javai.bpmncode.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort reconstruction of statements the grammar rejected.
 * <p>
 * Works on absolute token indices and never moves backwards. Diagnostics produced while
 * recovering accumulate here until the parser collects them with {@link #takeDiagnostics()}.
 */
public class ErrorRecovery {

	private static final Logger logger = LoggerFactory.getLogger(ErrorRecovery.class);

	private static final Set<TokenKind> ATTRIBUTE_RUN_END = EnumSet.of(
			TokenKind.AT, TokenKind.LEFT_PAREN, TokenKind.START, TokenKind.END, TokenKind.TASK,
			TokenKind.USER, TokenKind.SERVICE, TokenKind.SCRIPT, TokenKind.XOR, TokenKind.AND,
			TokenKind.RIGHT_BRACE, TokenKind.NEWLINE, TokenKind.CARRIAGE_RETURN_NEWLINE, TokenKind.EOF);

	private static final Set<TokenKind> SYNC_KEYWORDS = EnumSet.of(
			TokenKind.START, TokenKind.END, TokenKind.TASK, TokenKind.USER, TokenKind.SERVICE,
			TokenKind.SCRIPT, TokenKind.XOR, TokenKind.AND, TokenKind.EVENT, TokenKind.PROCESS,
			TokenKind.IMPORT, TokenKind.SUBPROCESS, TokenKind.POOL, TokenKind.LANE);

	private final CheckerSettings settings;
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	public ErrorRecovery(CheckerSettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("Settings cannot be null");
		}
		this.settings = settings;
	}

	public ErrorRecovery() {
		this(CheckerSettings.defaults());
	}

	/**
	 * A recovered value and the index of the first token after it.
	 */
	public record Recovered<T>(T value, int nextPosition) {
	}

	/**
	 * Rebuilds an element starting at {@code position}.
	 * <p>
	 * Start and end events and the task family are always rebuilt, with a {@code Task_<index>}
	 * placeholder when the id is missing; gateways tolerate a missing branch block and broken
	 * branches. Any other token cannot be recovered: an error is recorded and nothing returned.
	 */
	public Optional<Recovered<ProcessElement>> recoverElement(List<Token> tokens, int position) {
		if (position >= tokens.size()) {
			return Optional.empty();
		}

		Token token = tokens.get(position);
		Span span = token.span();
		if (token.isKind(TokenKind.START) && kindAt(tokens, position + 1).isFlowOperator()) {
			// A flow from the start sentinel; left to recoverFlow
			return Optional.empty();
		}

		Optional<Recovered<ProcessElement>> recovered = switch (token.kind()) {
			case START -> Optional.of(new Recovered<>(
					new ProcessElement.StartEvent(null, null, Map.of(), span),
					skipMalformedAttributes(tokens, position + 1)));
			case END -> Optional.of(new Recovered<>(
					new ProcessElement.EndEvent(null, null, Map.of(), span),
					skipMalformedAttributes(tokens, position + 1)));
			case TASK, USER, SERVICE, SCRIPT -> Optional.of(recoverTask(tokens, position));
			case XOR, AND -> Optional.of(recoverGateway(tokens, position));
			default -> {
				diagnostics.add(Diagnostic.error(DiagnosticKind.SYNTAX_ERROR,
						"Cannot recover from token '" + token.text() + "'", span));
				yield Optional.empty();
			}
		};

		recovered.ifPresent(r -> logger.debug("Recovered {} at {}, resuming at token {}",
				r.value().getClass().getSimpleName(), span, r.nextPosition()));
		return recovered;
	}

	private Recovered<ProcessElement> recoverTask(List<Token> tokens, int start) {
		Token keyword = tokens.get(start);
		TaskType taskType = switch (keyword.kind()) {
			case USER -> TaskType.USER;
			case SERVICE -> TaskType.SERVICE;
			case SCRIPT -> TaskType.SCRIPT;
			default -> TaskType.GENERIC;
		};

		int pos = start + 1;
		String id;
		if (kindAt(tokens, pos) == TokenKind.IDENTIFIER) {
			id = tokens.get(pos).text();
			pos++;
		} else {
			diagnostics.add(Diagnostic.warning(DiagnosticKind.MISSING_ELEMENT,
					"Missing task identifier, using default", keyword.span()));
			id = "Task_" + start;
		}

		pos = skipMalformedAttributes(tokens, pos);
		return new Recovered<>(new ProcessElement.Task(id, taskType, Map.of(), keyword.span()), pos);
	}

	private Recovered<ProcessElement> recoverGateway(List<Token> tokens, int start) {
		Token keyword = tokens.get(start);
		GatewayType gatewayType = keyword.isKind(TokenKind.XOR) ? GatewayType.EXCLUSIVE : GatewayType.PARALLEL;

		int pos = start + 1;
		String id = null;
		if (kindAt(tokens, pos) == TokenKind.IDENTIFIER) {
			id = tokens.get(pos).text();
			pos++;
		}
		if (kindAt(tokens, pos) == TokenKind.QUESTION) {
			pos++;
		}

		List<GatewayBranch> branches = new ArrayList<>();
		if (kindAt(tokens, pos) == TokenKind.LEFT_BRACE) {
			pos++;
			while (kindAt(tokens, pos) != TokenKind.RIGHT_BRACE && kindAt(tokens, pos) != TokenKind.EOF) {
				Recovered<GatewayBranch> branch = recoverBranch(tokens, pos);
				if (branch.value() != null) {
					branches.add(branch.value());
				}
				pos = branch.nextPosition();
			}
			if (kindAt(tokens, pos) == TokenKind.RIGHT_BRACE) {
				pos++;
			}
		} else {
			diagnostics.add(Diagnostic.error(DiagnosticKind.SYNTAX_ERROR,
					"Gateway missing branches block", keyword.span()));
		}

		return new Recovered<>(new ProcessElement.Gateway(id, gatewayType, branches, keyword.span()), pos);
	}

	/**
	 * Rebuilds one gateway branch. The value is {@code null} when no branch could be rebuilt; the
	 * next position is then past whatever was read, so a condition is never read twice.
	 */
	private Recovered<GatewayBranch> recoverBranch(List<Token> tokens, int start) {
		int pos = start;
		Span span = tokens.get(pos).span();
		String condition = null;
		boolean isDefault = false;

		switch (kindAt(tokens, pos)) {
			case LEFT_BRACKET -> {
				Recovered<String> text = readCondition(tokens, pos + 1);
				condition = text.value();
				pos = text.nextPosition();
			}
			case DEFAULT_FLOW -> isDefault = true;
			case IDENTIFIER -> {
				condition = tokens.get(pos).text();
				pos++;
			}
			default -> {
				return new Recovered<>(null, start + 1);
			}
		}

		TokenKind arrow = kindAt(tokens, pos);
		if (arrow != TokenKind.SEQUENCE_FLOW && arrow != TokenKind.DEFAULT_FLOW) {
			diagnostics.add(Diagnostic.error(DiagnosticKind.INVALID_FLOW, "Missing arrow in gateway branch", span));
			// The rest of the line belongs to the broken branch
			while (!kindAt(tokens, pos).isNewline() && kindAt(tokens, pos) != TokenKind.RIGHT_BRACE
					&& kindAt(tokens, pos) != TokenKind.EOF) {
				pos++;
			}
			return new Recovered<>(null, Math.max(pos, start + 1));
		}
		pos++;

		String target;
		TokenKind targetKind = kindAt(tokens, pos);
		if (targetKind == TokenKind.IDENTIFIER || targetKind == TokenKind.END) {
			target = tokens.get(pos).text();
			pos++;
		} else {
			diagnostics.add(Diagnostic.error(DiagnosticKind.INVALID_FLOW, "Missing target in gateway branch", span));
			target = "UnknownTarget_" + pos;
		}

		return new Recovered<>(new GatewayBranch(condition, target, isDefault, span), pos);
	}

	/**
	 * Rebuilds {@code from arrow to [cond]?} starting at {@code position}. Needs at least the
	 * source identifier and a known arrow; a missing target becomes an {@code UnknownTarget_<index>}
	 * placeholder with an error.
	 */
	public Optional<Recovered<Flow>> recoverFlow(List<Token> tokens, int position) {
		int pos = position;
		TokenKind sourceKind = kindAt(tokens, pos);
		if (sourceKind != TokenKind.IDENTIFIER && sourceKind != TokenKind.START) {
			return Optional.empty();
		}
		Token from = tokens.get(pos);
		pos++;

		Optional<FlowType> flowType = FlowType.fromArrow(kindAt(tokens, pos));
		if (flowType.isEmpty()) {
			return Optional.empty();
		}
		pos++;

		String to;
		TokenKind targetKind = kindAt(tokens, pos);
		if (targetKind == TokenKind.IDENTIFIER || targetKind == TokenKind.END) {
			to = tokens.get(pos).text();
			pos++;
		} else {
			diagnostics.add(Diagnostic.error(DiagnosticKind.INVALID_FLOW, "Missing target in flow", from.span()));
			to = "UnknownTarget_" + pos;
		}

		String condition = null;
		if (kindAt(tokens, pos) == TokenKind.LEFT_BRACKET) {
			Recovered<String> text = readCondition(tokens, pos + 1);
			condition = text.value();
			pos = text.nextPosition();
		}

		logger.debug("Recovered flow {} -> {} at {}", from.text(), to, from.span());
		return Optional.of(new Recovered<>(new Flow(from.text(), to, flowType.get(), condition, from.span()), pos));
	}

	/**
	 * Finds where parsing can safely resume after a failed top-level statement.
	 * <p>
	 * A {@code }} resumes after itself; an element, container, process or import keyword resumes
	 * at itself; anything else is skipped. The result is always past {@code statementStart}, so
	 * every call makes progress.
	 *
	 * @param statementStart index of the first token of the failed statement
	 * @param position index where the failure was detected
	 */
	public int findSyncPoint(List<Token> tokens, int statementStart, int position) {
		int pos = Math.max(position, statementStart + 1);
		while (pos < tokens.size()) {
			TokenKind kind = tokens.get(pos).kind();
			if (kind == TokenKind.RIGHT_BRACE) {
				return pos + 1;
			}
			if (SYNC_KEYWORDS.contains(kind) || kind == TokenKind.EOF) {
				return pos;
			}
			pos++;
		}
		return pos;
	}

	/**
	 * Returns the diagnostics recorded since the last call and forgets them.
	 */
	public List<Diagnostic> takeDiagnostics() {
		List<Diagnostic> taken = List.copyOf(diagnostics);
		diagnostics.clear();
		return taken;
	}

	/**
	 * Skips {@code @key ...} runs without reading their values, then one balanced
	 * {@code (...)} group.
	 */
	private int skipMalformedAttributes(List<Token> tokens, int start) {
		int pos = start;
		while (kindAt(tokens, pos) == TokenKind.AT) {
			pos++;
			while (!ATTRIBUTE_RUN_END.contains(kindAt(tokens, pos))) {
				pos++;
			}
		}

		if (kindAt(tokens, pos) == TokenKind.LEFT_PAREN) {
			pos++;
			int open = 1;
			while (open > 0 && kindAt(tokens, pos) != TokenKind.EOF) {
				switch (kindAt(tokens, pos)) {
					case LEFT_PAREN -> open++;
					case RIGHT_PAREN -> open--;
					default -> {
					}
				}
				pos++;
			}
		}
		return pos;
	}

	private Recovered<String> readCondition(List<Token> tokens, int start) {
		ConditionText text = new ConditionText();
		int pos = start;
		while (text.tokenCount() < settings.maxConditionTokens()) {
			TokenKind kind = kindAt(tokens, pos);
			if (kind == TokenKind.RIGHT_BRACKET || kind == TokenKind.RIGHT_BRACE || kind == TokenKind.EOF) {
				break;
			}
			if (!kind.isTrivia()) {
				text.append(tokens.get(pos).text());
			}
			pos++;
		}
		if (kindAt(tokens, pos) == TokenKind.RIGHT_BRACKET) {
			pos++;
		}
		return new Recovered<>(text.toString(), pos);
	}

	private static TokenKind kindAt(List<Token> tokens, int pos) {
		return pos < tokens.size() ? tokens.get(pos).kind() : TokenKind.EOF;
	}
}
