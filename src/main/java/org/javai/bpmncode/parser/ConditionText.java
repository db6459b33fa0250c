package org.javai.bpmncode.parser;

import java.util.Set;

/**
 * Rebuilds bracketed condition text from tokens. Tokens are joined by single spaces, except
 * that no space goes before operator characters, so {@code a = = b} reads back as {@code a== b}.
 */
final class ConditionText {

	private static final Set<String> NO_SPACE_BEFORE = Set.of("=", "!", "<", ">", "&", "|");

	private final StringBuilder text = new StringBuilder();
	private int tokenCount = 0;

	void append(String tokenText) {
		if (!text.isEmpty() && !NO_SPACE_BEFORE.contains(tokenText)) {
			text.append(' ');
		}
		text.append(tokenText);
		tokenCount++;
	}

	int tokenCount() {
		return tokenCount;
	}

	boolean isEmpty() {
		return text.isEmpty();
	}

	@Override
	public String toString() {
		return text.toString();
	}
}
