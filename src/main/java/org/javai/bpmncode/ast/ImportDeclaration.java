package org.javai.bpmncode.ast;

import java.util.List;
import java.util.Optional;
import org.javai.bpmncode.lexer.Span;

/**
 * Either {@code import "path" as alias} or {@code import a, b from "path"}; the two forms are
 * mutually exclusive, so at most one of {@code alias} and {@code items} is populated.
 */
public record ImportDeclaration(String path, String alias, List<String> items, Span span) {

	public ImportDeclaration {
		items = List.copyOf(items);
	}

	public Optional<String> aliasName() {
		return Optional.ofNullable(alias);
	}
}
