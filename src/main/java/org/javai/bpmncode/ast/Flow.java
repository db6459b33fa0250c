package org.javai.bpmncode.ast;

import java.util.Optional;
import org.javai.bpmncode.lexer.Span;

/**
 * Directed edge between two elements, e.g. {@code Review -> Approve [amount > 1000]}.
 *
 * @param from source id ({@code start} is always accepted)
 * @param to target id ({@code end} is always accepted)
 * @param flowType the arrow kind
 * @param condition reconstructed condition text, or {@code null}
 * @param span position of the flow statement
 */
public record Flow(String from, String to, FlowType flowType, String condition, Span span) {

	public Optional<String> conditionText() {
		return Optional.ofNullable(condition);
	}

	@Override
	public String toString() {
		return from + " " + flowType.arrow() + " " + to + (condition != null ? " [" + condition + "]" : "");
	}
}
