package org.javai.bpmncode.ast;

import java.util.Optional;
import org.javai.bpmncode.lexer.TokenKind;

public enum FlowType {
	SEQUENCE(TokenKind.SEQUENCE_FLOW),
	MESSAGE(TokenKind.MESSAGE_FLOW),
	DEFAULT(TokenKind.DEFAULT_FLOW),
	ASSOCIATION(TokenKind.ASSOCIATION);

	private final TokenKind arrow;

	FlowType(TokenKind arrow) {
		this.arrow = arrow;
	}

	public String arrow() {
		return arrow.lexeme();
	}

	public static Optional<FlowType> fromArrow(TokenKind kind) {
		for (FlowType type : values()) {
			if (type.arrow == kind) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
