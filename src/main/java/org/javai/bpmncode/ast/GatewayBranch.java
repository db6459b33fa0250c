package org.javai.bpmncode.ast;

import java.util.Optional;
import org.javai.bpmncode.lexer.Span;

/**
 * One outgoing branch of a gateway: {@code [cond] -> target}, {@code cond -> target} or
 * {@code => target} (the default branch, which has no condition).
 */
public record GatewayBranch(String condition, String target, boolean isDefault, Span span) {

	public Optional<String> conditionText() {
		return Optional.ofNullable(condition);
	}
}
