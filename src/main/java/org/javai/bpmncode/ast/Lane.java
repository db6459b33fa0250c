package org.javai.bpmncode.ast;

import java.util.List;
import org.javai.bpmncode.lexer.Span;

public record Lane(String name, List<ProcessElement> elements, Span span) {

	public Lane {
		elements = List.copyOf(elements);
	}
}
