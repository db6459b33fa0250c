package org.javai.bpmncode.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.javai.bpmncode.ast.AttributeValue;
import org.javai.bpmncode.ast.Document;
import org.javai.bpmncode.ast.EventType;
import org.javai.bpmncode.ast.Flow;
import org.javai.bpmncode.ast.FlowType;
import org.javai.bpmncode.ast.GatewayBranch;
import org.javai.bpmncode.ast.GatewayType;
import org.javai.bpmncode.ast.ImportDeclaration;
import org.javai.bpmncode.ast.Lane;
import org.javai.bpmncode.ast.ProcessDeclaration;
import org.javai.bpmncode.ast.ProcessElement;
import org.javai.bpmncode.ast.TaskType;
import org.javai.bpmncode.config.CheckerSettings;
import org.javai.bpmncode.diagnostics.Diagnostic;
import org.javai.bpmncode.diagnostics.DiagnosticKind;
import org.javai.bpmncode.diagnostics.Severity;
import org.javai.bpmncode.diagnostics.SuggestionEngine;
import org.javai.bpmncode.lexer.Token;
import org.javai.bpmncode.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for BPMNCode with error recovery.
 * <p>
 * Parsing never fails as a whole: every problem becomes a diagnostic on the returned
 * {@link Document} and parsing resumes at the next statement. Inside a block each statement is
 * tried as an element, then as a flow, then handed to {@link ErrorRecovery}; if nothing fits,
 * the offending token is skipped with a warning.
 * <p>
 * Example usage:
 *
 * <pre>
 * List&lt;Token&gt; tokens = BpmnTokenizer.tokenize(source, path);
 * Document document = new BpmnParser().parseWithRecovery(tokens);
 * </pre>
 *
 * Instances hold only configuration and may be shared; all parse state lives in a
 * {@link ParserState} created per call.
 */
public class BpmnParser {

	private static final Logger logger = LoggerFactory.getLogger(BpmnParser.class);

	private static final Pattern PLAIN_NUMBER = Pattern.compile("[0-9]+(\\.[0-9]+)?");

	private static final String EXPECTED_ELEMENT = "process element";
	private static final String EXPECTED_IDENTIFIER = "identifier";
	private static final String EXPECTED_ATTRIBUTE_VALUE = "attribute value (string, number, boolean)";

	private final CheckerSettings settings;
	private final SuggestionEngine suggestions;

	public BpmnParser(CheckerSettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("Settings cannot be null");
		}
		this.settings = settings;
		this.suggestions = new SuggestionEngine(settings);
	}

	public BpmnParser() {
		this(CheckerSettings.defaults());
	}

	/**
	 * Parses a token list produced by the tokenizer.
	 *
	 * @param tokens tokens ending with EOF; a missing EOF is supplied
	 * @return the document, never {@code null}
	 */
	public Document parseWithRecovery(List<Token> tokens) {
		ParserState state = new ParserState(tokens);
		ErrorRecovery recovery = new ErrorRecovery(settings);
		List<ImportDeclaration> imports = new ArrayList<>();
		List<ProcessDeclaration> processes = new ArrayList<>();

		state.skipTrivia();
		while (!state.isAtEnd()) {
			int statementStart = state.position();

			if (state.check(TokenKind.IMPORT)) {
				ParseResult<ImportDeclaration> result = parseImport(state);
				if (result.isSuccess()) {
					imports.add(result.value());
				} else {
					resynchronize(state, recovery, statementStart, result.error());
				}
			} else if (state.check(TokenKind.PROCESS)) {
				ParseResult<ProcessDeclaration> result = parseProcess(state, recovery);
				if (result.isSuccess()) {
					processes.add(result.value());
				} else {
					resynchronize(state, recovery, statementStart, result.error());
				}
			} else {
				skipStrayTokens(state);
			}

			state.skipTrivia();
		}

		logger.debug("Parsed {} import(s) and {} process(es) with {} diagnostic(s)",
				imports.size(), processes.size(), state.diagnostics().size());
		return new Document(imports, processes, state.diagnostics());
	}

	private void resynchronize(ParserState state, ErrorRecovery recovery, int statementStart, ParserError error) {
		state.report(error.toDiagnostic(Severity.ERROR, suggestions));
		int syncPoint = recovery.findSyncPoint(state.tokens(), statementStart, state.position());
		logger.debug("{}; resuming at token {}", error, syncPoint);
		state.seek(syncPoint);
	}

	/**
	 * Reports the token in statement position once, then skips to the next {@code process} or
	 * {@code import} keyword.
	 */
	private void skipStrayTokens(ParserState state) {
		Token stray = state.advance();
		List<String> candidates = suggestions.suggestKeywords(stray.text()).stream()
				.filter(keyword -> !keyword.equals(stray.text()))
				.toList();
		state.report(new Diagnostic(DiagnosticKind.UNEXPECTED_TOKEN, "Unexpected token '" + stray.text() + "'",
				stray.span(), Severity.ERROR, candidates));

		while (!state.isAtEnd() && !state.check(TokenKind.PROCESS) && !state.check(TokenKind.IMPORT)) {
			state.advance();
		}
	}

	// Imports

	private ParseResult<ImportDeclaration> parseImport(ParserState state) {
		Token keyword = state.advance();

		if (state.check(TokenKind.STRING_LITERAL)) {
			String path = unescape(state.advance().text());
			String alias = null;
			if (state.match(TokenKind.AS)) {
				ParseResult<String> name = identifier(state);
				if (name.isFailure()) {
					return name.propagate();
				}
				alias = name.value();
			}
			return ParseResult.success(new ImportDeclaration(path, alias, List.of(), keyword.span()));
		}

		List<String> items = new ArrayList<>();
		do {
			ParseResult<String> item = identifier(state);
			if (item.isFailure()) {
				return item.propagate();
			}
			items.add(item.value());
		} while (state.match(TokenKind.COMMA));

		if (!state.match(TokenKind.FROM)) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.FROM));
		}
		if (!state.check(TokenKind.STRING_LITERAL)) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.STRING_LITERAL));
		}
		String path = unescape(state.advance().text());
		return ParseResult.success(new ImportDeclaration(path, null, items, keyword.span()));
	}

	// Processes and bodies

	private ParseResult<ProcessDeclaration> parseProcess(ParserState state, ErrorRecovery recovery) {
		Token keyword = state.advance();

		ParseResult<String> name = identifier(state);
		if (name.isFailure()) {
			return name.propagate();
		}

		Map<String, AttributeValue> attributes = parseProcessAttributes(state);

		state.skipTrivia();
		if (!state.match(TokenKind.LEFT_BRACE)) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.LEFT_BRACE));
		}

		ContainerBody body = parseBody(state, recovery, BodyKind.PROCESS, name.value());
		return ParseResult.success(new ProcessDeclaration(name.value(), attributes, body.elements(), body.flows(),
				keyword.span()));
	}

	/**
	 * Malformed process attributes are reported and skipped so the body is still parsed.
	 */
	private Map<String, AttributeValue> parseProcessAttributes(ParserState state) {
		ParseResult<Map<String, AttributeValue>> attributes = parseAttributes(state);
		if (attributes.isSuccess()) {
			return attributes.value();
		}

		state.report(attributes.error().toDiagnostic(Severity.ERROR, suggestions));
		while (!state.isAtEnd() && !state.check(TokenKind.LEFT_BRACE) && !state.check(TokenKind.RIGHT_BRACE)
				&& !state.peek().kind().isNewline()) {
			state.advance();
		}
		return Map.of();
	}

	/**
	 * Parses statements up to and including the closing brace of the block whose opening brace
	 * was just consumed. A missing closing brace is reported and whatever was read is kept.
	 */
	private ContainerBody parseBody(ParserState state, ErrorRecovery recovery, BodyKind kind, String name) {
		List<ProcessElement> elements = new ArrayList<>();
		List<Flow> flows = new ArrayList<>();
		List<Lane> lanes = new ArrayList<>();

		state.skipTrivia();
		while (!state.check(TokenKind.RIGHT_BRACE) && !state.isAtEnd()) {
			parseStatement(state, recovery, kind, elements, flows, lanes);
			state.skipTrivia();
		}

		if (!state.match(TokenKind.RIGHT_BRACE)) {
			state.report(Diagnostic.error(DiagnosticKind.UNCLOSED_BLOCK, kind.missingBraceMessage(name),
					state.peek().span()));
		}
		return new ContainerBody(elements, flows, lanes);
	}

	private void parseStatement(ParserState state, ErrorRecovery recovery, BodyKind kind,
			List<ProcessElement> elements, List<Flow> flows, List<Lane> lanes) {
		ParserState.Snapshot mark = state.mark();

		ParserError elementError;
		if (kind.allowsLanes() && state.check(TokenKind.LANE)) {
			ParseResult<Lane> lane = parseLane(state, recovery);
			if (lane.isSuccess()) {
				lanes.add(lane.value());
				return;
			}
			elementError = lane.error();
		} else {
			ParseResult<ProcessElement> element = parseElement(state, recovery);
			if (element.isSuccess()) {
				elements.add(element.value());
				return;
			}
			elementError = element.error();
		}
		state.reset(mark);

		ParserError flowError = null;
		if (kind.allowsFlows()) {
			ParseResult<Flow> flow = parseFlow(state);
			if (flow.isSuccess()) {
				flows.add(flow.value());
				return;
			}
			flowError = flow.error();
			state.reset(mark);
		}

		recoverStatement(state, recovery, kind, elementError, flowError, elements, flows);
	}

	private void recoverStatement(ParserState state, ErrorRecovery recovery, BodyKind kind, ParserError elementError,
			ParserError flowError, List<ProcessElement> elements, List<Flow> flows) {
		int position = state.position();

		Optional<ErrorRecovery.Recovered<ProcessElement>> element = recovery.recoverElement(state.tokens(), position);
		List<Diagnostic> elementNotes = recovery.takeDiagnostics();
		if (element.isPresent()) {
			// Silent recoveries still owe the user the grammar error that triggered them
			if (elementNotes.isEmpty()) {
				state.report(elementError.toDiagnostic(Severity.ERROR, suggestions));
			}
			state.reportAll(elementNotes);
			elements.add(element.get().value());
			state.seek(element.get().nextPosition());
			return;
		}

		if (kind.allowsFlows()) {
			Optional<ErrorRecovery.Recovered<Flow>> flow = recovery.recoverFlow(state.tokens(), position);
			List<Diagnostic> flowNotes = recovery.takeDiagnostics();
			if (flow.isPresent()) {
				if (flowNotes.isEmpty() && flowError != null) {
					state.report(flowError.toDiagnostic(Severity.ERROR, suggestions));
				}
				state.reportAll(flowNotes);
				flows.add(flow.get().value());
				state.seek(flow.get().nextPosition());
				return;
			}
		}

		state.reportAll(elementNotes);
		Token skipped = state.advance();
		state.report(Diagnostic.warning(DiagnosticKind.UNEXPECTED_TOKEN,
				"Skipping unexpected token '" + skipped.text() + "'", skipped.span()));
	}

	/**
	 * Parses the body of a nested container, or skips it when nesting is already at the limit.
	 */
	private ContainerBody parseNestedBody(ParserState state, ErrorRecovery recovery, BodyKind kind, String name) {
		Token brace = state.peek();
		if (!state.match(TokenKind.LEFT_BRACE)) {
			return null;
		}

		if (state.depth() >= settings.maxNestingDepth()) {
			state.report(Diagnostic.error(DiagnosticKind.SYNTAX_ERROR,
					"Nesting deeper than " + settings.maxNestingDepth() + " levels; skipping "
							+ kind.describe(name) + " body",
					brace.span()));
			if (!skipBalanced(state)) {
				state.report(Diagnostic.error(DiagnosticKind.UNCLOSED_BLOCK, kind.missingBraceMessage(name),
						state.peek().span()));
			}
			return ContainerBody.empty();
		}

		state.enterContainer();
		ContainerBody body = parseBody(state, recovery, kind, name);
		state.exitContainer();
		return body;
	}

	private boolean skipBalanced(ParserState state) {
		int open = 1;
		while (!state.isAtEnd()) {
			Token token = state.advance();
			if (token.isKind(TokenKind.LEFT_BRACE)) {
				open++;
			} else if (token.isKind(TokenKind.RIGHT_BRACE) && --open == 0) {
				return true;
			}
		}
		return false;
	}

	// Elements

	private ParseResult<ProcessElement> parseElement(ParserState state, ErrorRecovery recovery) {
		Token keyword = state.peek();

		return switch (keyword.kind()) {
			case START, END -> parseEvent(state);
			case TASK, USER, SERVICE, SCRIPT -> parseTask(state);
			case CALL -> parseCallActivity(state);
			case XOR, AND -> parseGateway(state);
			case EVENT -> parseIntermediateEvent(state);
			case SUBPROCESS -> parseSubprocess(state, recovery);
			case POOL -> parsePool(state, recovery);
			case GROUP -> parseGroup(state, recovery);
			case NOTE -> parseNote(state);
			default -> ParseResult.failure(ParserError.unexpectedToken(keyword, EXPECTED_ELEMENT));
		};
	}

	private ParseResult<ProcessElement> parseEvent(ParserState state) {
		Token keyword = state.advance();

		// "start -> A" is a flow from the start sentinel
		if (keyword.isKind(TokenKind.START) && state.peek().kind().isFlowOperator()) {
			return ParseResult.failure(ParserError.unexpectedToken(state.peek(), EXPECTED_ELEMENT));
		}

		ParseResult<Optional<EventType>> eventType = parseEventType(state);
		if (eventType.isFailure()) {
			return eventType.propagate();
		}
		ParseResult<Map<String, AttributeValue>> attributes = parseAttributes(state);
		if (attributes.isFailure()) {
			return attributes.propagate();
		}

		EventType type = eventType.value().orElse(null);
		if (keyword.isKind(TokenKind.START)) {
			return ParseResult.success(new ProcessElement.StartEvent(null, type, attributes.value(), keyword.span()));
		}
		return ParseResult.success(new ProcessElement.EndEvent(null, type, attributes.value(), keyword.span()));
	}

	private ParseResult<ProcessElement> parseTask(ParserState state) {
		Token keyword = state.advance();
		TaskType taskType = switch (keyword.kind()) {
			case USER -> TaskType.USER;
			case SERVICE -> TaskType.SERVICE;
			case SCRIPT -> TaskType.SCRIPT;
			default -> TaskType.GENERIC;
		};

		ParseResult<String> id = identifier(state);
		if (id.isFailure()) {
			return id.propagate();
		}
		ParseResult<Map<String, AttributeValue>> attributes = parseAttributes(state);
		if (attributes.isFailure()) {
			return attributes.propagate();
		}
		return ParseResult.success(new ProcessElement.Task(id.value(), taskType, attributes.value(), keyword.span()));
	}

	private ParseResult<ProcessElement> parseCallActivity(ParserState state) {
		Token keyword = state.advance();

		ParseResult<String> id = identifier(state);
		if (id.isFailure()) {
			return id.propagate();
		}
		String calledElement = id.value();
		if (state.match(TokenKind.NAMESPACE)) {
			ParseResult<String> member = identifier(state);
			if (member.isFailure()) {
				return member.propagate();
			}
			calledElement = id.value() + "::" + member.value();
		}

		ParseResult<Map<String, AttributeValue>> attributes = parseAttributes(state);
		if (attributes.isFailure()) {
			return attributes.propagate();
		}
		return ParseResult.success(new ProcessElement.CallActivity(id.value(), calledElement, attributes.value(),
				keyword.span()));
	}

	private ParseResult<ProcessElement> parseGateway(ParserState state) {
		Token keyword = state.advance();
		GatewayType gatewayType = keyword.isKind(TokenKind.XOR) ? GatewayType.EXCLUSIVE : GatewayType.PARALLEL;

		String id = state.check(TokenKind.IDENTIFIER) ? state.advance().text() : null;
		state.match(TokenKind.QUESTION);

		state.skipTrivia();
		if (!state.match(TokenKind.LEFT_BRACE)) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.LEFT_BRACE));
		}

		ParseResult<List<GatewayBranch>> branches = parseGatewayBranches(state);
		if (branches.isFailure()) {
			return branches.propagate();
		}
		if (!state.match(TokenKind.RIGHT_BRACE)) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.RIGHT_BRACE));
		}
		return ParseResult.success(new ProcessElement.Gateway(id, gatewayType, branches.value(), keyword.span()));
	}

	/**
	 * Branches until the closing brace, which is left for the caller. Each branch is
	 * {@code [cond] -> target}, {@code cond -> target} or {@code => target}.
	 */
	private ParseResult<List<GatewayBranch>> parseGatewayBranches(ParserState state) {
		List<GatewayBranch> branches = new ArrayList<>();

		state.skipTrivia();
		while (!state.check(TokenKind.RIGHT_BRACE) && !state.isAtEnd()) {
			Token first = state.peek();
			String condition = null;
			boolean isDefault = false;

			if (state.match(TokenKind.LEFT_BRACKET)) {
				ParseResult<String> text = parseBracketedCondition(state);
				if (text.isFailure()) {
					return text.propagate();
				}
				condition = text.value();
			} else if (state.check(TokenKind.DEFAULT_FLOW)) {
				isDefault = true;
			} else {
				ParseResult<String> shorthand = identifier(state);
				if (shorthand.isFailure()) {
					return shorthand.propagate();
				}
				condition = shorthand.value();
			}

			if (!state.check(TokenKind.SEQUENCE_FLOW) && !state.check(TokenKind.DEFAULT_FLOW)) {
				return ParseResult.failure(ParserError.unexpectedToken(state.peek(), "-> or =>"));
			}
			state.advance();

			ParseResult<String> target = target(state);
			if (target.isFailure()) {
				return target.propagate();
			}

			branches.add(new GatewayBranch(condition, target.value(), isDefault, first.span()));
			state.skipTrivia();
		}

		return ParseResult.success(branches);
	}

	private ParseResult<ProcessElement> parseIntermediateEvent(ParserState state) {
		Token keyword = state.advance();

		ParseResult<Optional<EventType>> eventType = parseEventType(state);
		if (eventType.isFailure()) {
			return eventType.propagate();
		}
		if (eventType.value().isEmpty()) {
			return ParseResult.failure(ParserError.unexpectedToken(state.peek(), ParserError.EXPECTED_EVENT_TYPE));
		}

		String payload = null;
		Token next = state.peek();
		if (next.isKind(TokenKind.STRING_LITERAL)) {
			payload = unescape(state.advance().text());
		} else if (next.isKind(TokenKind.NUMBER_LITERAL) || next.isKind(TokenKind.IDENTIFIER)) {
			payload = state.advance().text();
		}

		ParseResult<Map<String, AttributeValue>> attributes = parseAttributes(state);
		if (attributes.isFailure()) {
			return attributes.propagate();
		}
		return ParseResult.success(new ProcessElement.IntermediateEvent(null, eventType.value().get(), payload,
				attributes.value(), keyword.span()));
	}

	private ParseResult<ProcessElement> parseSubprocess(ParserState state, ErrorRecovery recovery) {
		Token keyword = state.advance();

		ParseResult<String> id = identifier(state);
		if (id.isFailure()) {
			return id.propagate();
		}
		ParseResult<Map<String, AttributeValue>> attributes = parseAttributes(state);
		if (attributes.isFailure()) {
			return attributes.propagate();
		}

		state.skipTrivia();
		ContainerBody body = parseNestedBody(state, recovery, BodyKind.SUBPROCESS, id.value());
		if (body == null) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.LEFT_BRACE));
		}
		return ParseResult.success(new ProcessElement.Subprocess(id.value(), body.elements(), body.flows(),
				attributes.value(), keyword.span()));
	}

	private ParseResult<ProcessElement> parsePool(ParserState state, ErrorRecovery recovery) {
		Token keyword = state.advance();

		ParseResult<String> name = identifier(state);
		if (name.isFailure()) {
			return name.propagate();
		}

		state.skipTrivia();
		ContainerBody body = parseNestedBody(state, recovery, BodyKind.POOL, name.value());
		if (body == null) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.LEFT_BRACE));
		}
		return ParseResult.success(new ProcessElement.Pool(name.value(), body.lanes(), body.elements(), body.flows(),
				keyword.span()));
	}

	private ParseResult<Lane> parseLane(ParserState state, ErrorRecovery recovery) {
		Token keyword = state.advance();

		ParseResult<String> name = identifier(state);
		if (name.isFailure()) {
			return name.propagate();
		}

		state.skipTrivia();
		ContainerBody body = parseNestedBody(state, recovery, BodyKind.LANE, name.value());
		if (body == null) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.LEFT_BRACE));
		}
		return ParseResult.success(new Lane(name.value(), body.elements(), keyword.span()));
	}

	private ParseResult<ProcessElement> parseGroup(ParserState state, ErrorRecovery recovery) {
		Token keyword = state.advance();

		if (!state.check(TokenKind.STRING_LITERAL)) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.STRING_LITERAL));
		}
		String label = unescape(state.advance().text());

		state.skipTrivia();
		ContainerBody body = parseNestedBody(state, recovery, BodyKind.GROUP, label);
		if (body == null) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.LEFT_BRACE));
		}
		return ParseResult.success(new ProcessElement.Group(label, body.elements(), keyword.span()));
	}

	private ParseResult<ProcessElement> parseNote(ParserState state) {
		Token keyword = state.advance();

		if (!state.check(TokenKind.STRING_LITERAL)) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.STRING_LITERAL));
		}
		return ParseResult.success(new ProcessElement.Annotation(unescape(state.advance().text()), keyword.span()));
	}

	/**
	 * Optional {@code @message "payload"}, {@code @timer 5m}, {@code @error "code"},
	 * {@code @signal "name"} or {@code @terminate}.
	 */
	private ParseResult<Optional<EventType>> parseEventType(ParserState state) {
		if (!state.match(TokenKind.AT)) {
			return ParseResult.success(Optional.empty());
		}

		Token name = state.peek();
		if (!name.isKind(TokenKind.IDENTIFIER)) {
			return ParseResult.failure(ParserError.unexpectedToken(name, ParserError.EXPECTED_EVENT_TYPE));
		}
		state.advance();

		EventType eventType = switch (name.text()) {
			case "message" -> new EventType.Message(optionalString(state));
			case "timer" -> {
				boolean hasDuration = state.check(TokenKind.NUMBER_LITERAL) || state.check(TokenKind.IDENTIFIER);
				yield new EventType.Timer(hasDuration ? state.advance().text() : "");
			}
			case "error" -> new EventType.ErrorCode(optionalString(state));
			case "signal" -> new EventType.Signal(optionalString(state));
			case "terminate" -> new EventType.Terminate();
			default -> null;
		};

		if (eventType == null) {
			return ParseResult.failure(ParserError.unexpectedToken(name, ParserError.EXPECTED_EVENT_TYPE));
		}
		return ParseResult.success(Optional.of(eventType));
	}

	private String optionalString(ParserState state) {
		return state.check(TokenKind.STRING_LITERAL) ? unescape(state.advance().text()) : "";
	}

	// Flows

	private ParseResult<Flow> parseFlow(ParserState state) {
		Token from = state.peek();
		if (!from.isKind(TokenKind.IDENTIFIER) && !from.isKind(TokenKind.START)) {
			return ParseResult.failure(ParserError.unexpectedToken(from, EXPECTED_IDENTIFIER));
		}
		state.advance();

		Optional<FlowType> flowType = FlowType.fromArrow(state.peek().kind());
		if (flowType.isEmpty()) {
			return ParseResult.failure(ParserError.unexpectedToken(state.peek(), ParserError.EXPECTED_FLOW_ARROW));
		}
		state.advance();

		ParseResult<String> to = target(state);
		if (to.isFailure()) {
			return to.propagate();
		}

		String condition = null;
		if (state.match(TokenKind.LEFT_BRACKET)) {
			ParseResult<String> text = parseBracketedCondition(state);
			if (text.isFailure()) {
				return text.propagate();
			}
			condition = text.value();
		}

		return ParseResult.success(new Flow(from.text(), to.value(), flowType.get(), condition, from.span()));
	}

	/**
	 * Condition text after an opening bracket, through the closing bracket.
	 */
	private ParseResult<String> parseBracketedCondition(ParserState state) {
		ConditionText text = new ConditionText();
		while (!state.check(TokenKind.RIGHT_BRACKET) && !state.check(TokenKind.RIGHT_BRACE) && !state.isAtEnd()
				&& text.tokenCount() < settings.maxConditionTokens()) {
			Token token = state.advance();
			if (!token.isTrivia()) {
				text.append(token.text());
			}
		}

		if (text.isEmpty()) {
			return ParseResult.failure(ParserError.unexpectedToken(state.peek(), "condition expression"));
		}
		if (!state.match(TokenKind.RIGHT_BRACKET)) {
			return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.RIGHT_BRACKET));
		}
		return ParseResult.success(text.toString());
	}

	// Attributes

	/**
	 * Zero or more {@code @key value?} entries followed by an optional {@code (key=value, ...)}
	 * list. A key seen twice keeps its last value.
	 */
	private ParseResult<Map<String, AttributeValue>> parseAttributes(ParserState state) {
		Map<String, AttributeValue> attributes = new LinkedHashMap<>();

		while (state.match(TokenKind.AT)) {
			Token key = state.peek();
			if (!isAttributeKey(key)) {
				return ParseResult.failure(ParserError.unexpectedToken(key, "attribute name"));
			}
			state.advance();

			AttributeValue value = new AttributeValue.BooleanValue(true);
			if (state.check(TokenKind.STRING_LITERAL) || state.check(TokenKind.NUMBER_LITERAL)
					|| state.check(TokenKind.IDENTIFIER)) {
				ParseResult<AttributeValue> parsed = parseAttributeValue(state);
				if (parsed.isFailure()) {
					return parsed.propagate();
				}
				value = parsed.value();
			}
			attributes.put(key.text(), value);
		}

		if (state.match(TokenKind.LEFT_PAREN)) {
			state.skipTrivia();
			while (!state.check(TokenKind.RIGHT_PAREN) && !state.isAtEnd()) {
				Token key = state.peek();
				if (!isAttributeKey(key)) {
					return ParseResult.failure(ParserError.unexpectedToken(key, "attribute name"));
				}
				state.advance();

				if (!state.match(TokenKind.EQUALS)) {
					return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.EQUALS));
				}
				ParseResult<AttributeValue> value = parseAttributeValue(state);
				if (value.isFailure()) {
					return value.propagate();
				}
				attributes.put(key.text(), value.value());

				state.skipTrivia();
				if (state.match(TokenKind.COMMA)) {
					state.skipTrivia();
				}
			}
			if (!state.match(TokenKind.RIGHT_PAREN)) {
				return ParseResult.failure(ParserError.expected(state.peek(), TokenKind.RIGHT_PAREN));
			}
		}

		return ParseResult.success(attributes);
	}

	private ParseResult<AttributeValue> parseAttributeValue(ParserState state) {
		Token token = state.peek();

		switch (token.kind()) {
			case STRING_LITERAL -> {
				state.advance();
				return ParseResult.success(new AttributeValue.StringValue(unescape(token.text())));
			}
			case NUMBER_LITERAL -> {
				state.advance();
				String text = token.text();
				if (text.endsWith("m") || text.endsWith("s") || text.endsWith("h")) {
					return ParseResult.success(new AttributeValue.DurationValue(text));
				}
				if (PLAIN_NUMBER.matcher(text).matches()) {
					return ParseResult.success(new AttributeValue.NumberValue(Double.parseDouble(text)));
				}
				return ParseResult.failure(ParserError.invalidAttributeValue(token));
			}
			case IDENTIFIER -> {
				state.advance();
				return ParseResult.success(switch (token.text()) {
					case "true" -> new AttributeValue.BooleanValue(true);
					case "false" -> new AttributeValue.BooleanValue(false);
					default -> new AttributeValue.StringValue(token.text());
				});
			}
			default -> {
				return ParseResult.failure(ParserError.unexpectedToken(token, EXPECTED_ATTRIBUTE_VALUE));
			}
		}
	}

	// Shared pieces

	private boolean isAttributeKey(Token token) {
		return token.isKind(TokenKind.IDENTIFIER) || token.kind().isKeyword();
	}

	private ParseResult<String> identifier(ParserState state) {
		if (!state.check(TokenKind.IDENTIFIER)) {
			return ParseResult.failure(ParserError.unexpectedToken(state.peek(), EXPECTED_IDENTIFIER));
		}
		return ParseResult.success(state.advance().text());
	}

	/**
	 * Flow or branch target: an identifier or the {@code end} sentinel.
	 */
	private ParseResult<String> target(ParserState state) {
		if (state.check(TokenKind.END)) {
			return ParseResult.success(state.advance().text());
		}
		return identifier(state);
	}

	/**
	 * Strips the quotes and resolves {@code \" \\ \n \t}; any other escape is kept as written.
	 */
	static String unescape(String literal) {
		if (literal.length() < 2 || !literal.startsWith("\"") || !literal.endsWith("\"")) {
			return literal;
		}
		String body = literal.substring(1, literal.length() - 1);
		if (body.indexOf('\\') < 0) {
			return body;
		}

		StringBuilder result = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c == '\\' && i + 1 < body.length()) {
				char next = body.charAt(i + 1);
				switch (next) {
					case '"' -> result.append('"');
					case '\\' -> result.append('\\');
					case 'n' -> result.append('\n');
					case 't' -> result.append('\t');
					default -> result.append(c).append(next);
				}
				i++;
			} else {
				result.append(c);
			}
		}
		return result.toString();
	}

	/**
	 * Kinds of block body, which differ in what statements they accept.
	 */
	private enum BodyKind {
		PROCESS("process", true, false),
		SUBPROCESS("subprocess", true, false),
		POOL("pool", true, true),
		LANE("lane", false, false),
		GROUP("group", false, false);

		private final String label;
		private final boolean flows;
		private final boolean lanes;

		BodyKind(String label, boolean flows, boolean lanes) {
			this.label = label;
			this.flows = flows;
			this.lanes = lanes;
		}

		boolean allowsFlows() {
			return flows;
		}

		boolean allowsLanes() {
			return lanes;
		}

		String describe(String name) {
			return label + " '" + name + "'";
		}

		String missingBraceMessage(String name) {
			return this == PROCESS ? "Missing closing brace for process" : "Missing closing brace for " + describe(name);
		}
	}
}
