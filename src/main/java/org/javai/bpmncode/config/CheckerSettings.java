package org.javai.bpmncode.config;

import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Tunable thresholds and candidate lists shared by the suggestion engine, the context validator
 * and the parser.
 *
 * @param similarityThreshold candidates scoring at or below this are never suggested
 * @param keywordTypoThreshold a keyword must score above this to be offered as the single fix
 * @param maxSuggestions suggestion limit for keywords, event types, attributes and identifiers
 * @param maxFlowSuggestions suggestion limit for flow operators
 * @param maxConditionTokens significant tokens read into one bracketed condition
 * @param maxNestingDepth deepest container nesting the parser descends into
 * @param gatewayLookahead tokens scanned after a brace-less gateway for branch syntax
 * @param keywords keyword candidates
 * @param eventTypes event type candidates
 * @param flowOperators flow operator candidates
 * @param attributeNames attribute name candidates
 */
public record CheckerSettings(
		double similarityThreshold,
		double keywordTypoThreshold,
		int maxSuggestions,
		int maxFlowSuggestions,
		int maxConditionTokens,
		int maxNestingDepth,
		int gatewayLookahead,
		List<String> keywords,
		List<String> eventTypes,
		List<String> flowOperators,
		List<String> attributeNames
) {

	public static final List<String> DEFAULT_KEYWORDS = List.of(
			"process", "start", "end", "task", "user", "service", "script", "call", "xor", "and",
			"event", "pool", "lane", "group", "note", "subprocess", "import", "from", "as");

	public static final List<String> DEFAULT_EVENT_TYPES = List.of(
			"message", "timer", "error", "signal", "terminate", "escalation", "compensation", "conditional");

	public static final List<String> DEFAULT_FLOW_OPERATORS = List.of("->", "-->", "=>", "..>");

	public static final List<String> DEFAULT_ATTRIBUTE_NAMES = List.of(
			"timeout", "assignee", "priority", "endpoint", "method", "script", "params", "version",
			"author", "description", "collapsed", "parallel", "required", "secure", "instant", "form");

	private static final CheckerSettings DEFAULTS = new CheckerSettings(
			0.6, 0.75, 3, 2, 50, 64, 10,
			DEFAULT_KEYWORDS, DEFAULT_EVENT_TYPES, DEFAULT_FLOW_OPERATORS, DEFAULT_ATTRIBUTE_NAMES);

	public CheckerSettings {
		Validate.inclusiveBetween(0.0, 1.0, similarityThreshold, "similarityThreshold must be within [0, 1]");
		Validate.inclusiveBetween(0.0, 1.0, keywordTypoThreshold, "keywordTypoThreshold must be within [0, 1]");
		Validate.isTrue(maxSuggestions >= 0, "maxSuggestions must not be negative");
		Validate.isTrue(maxFlowSuggestions >= 0, "maxFlowSuggestions must not be negative");
		Validate.isTrue(maxConditionTokens > 0, "maxConditionTokens must be positive");
		Validate.isTrue(maxNestingDepth > 0, "maxNestingDepth must be positive");
		Validate.isTrue(gatewayLookahead > 0, "gatewayLookahead must be positive");
		keywords = List.copyOf(Validate.notNull(keywords, "keywords"));
		eventTypes = List.copyOf(Validate.notNull(eventTypes, "eventTypes"));
		flowOperators = List.copyOf(Validate.notNull(flowOperators, "flowOperators"));
		attributeNames = List.copyOf(Validate.notNull(attributeNames, "attributeNames"));
	}

	/**
	 * Built-in settings, identical to the bundled {@code META-INF/bpmncode-settings.yml}.
	 */
	public static CheckerSettings defaults() {
		return DEFAULTS;
	}

	public CheckerSettings withMaxNestingDepth(int depth) {
		return new CheckerSettings(similarityThreshold, keywordTypoThreshold, maxSuggestions, maxFlowSuggestions,
				maxConditionTokens, depth, gatewayLookahead, keywords, eventTypes, flowOperators, attributeNames);
	}

	public CheckerSettings withThresholds(double similarity, double keywordTypo) {
		return new CheckerSettings(similarity, keywordTypo, maxSuggestions, maxFlowSuggestions,
				maxConditionTokens, maxNestingDepth, gatewayLookahead, keywords, eventTypes, flowOperators,
				attributeNames);
	}
}
