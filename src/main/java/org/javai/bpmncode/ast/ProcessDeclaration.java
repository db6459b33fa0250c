package org.javai.bpmncode.ast;

import java.util.List;
import java.util.Map;
import org.javai.bpmncode.lexer.Span;

/**
 * A {@code process Name attrs? { ... }} block.
 *
 * @param name the process name
 * @param attributes process attributes in declaration order; a repeated key keeps the last value
 * @param elements top-level elements in reading order
 * @param flows top-level flows in reading order
 * @param span position of the {@code process} keyword
 */
public record ProcessDeclaration(String name, Map<String, AttributeValue> attributes,
		List<ProcessElement> elements, List<Flow> flows, Span span) {

	public ProcessDeclaration {
		attributes = ProcessElement.copyAttributes(attributes);
		elements = List.copyOf(elements);
		flows = List.copyOf(flows);
	}

	public boolean hasStartEvent() {
		return elements.stream().anyMatch(ProcessElement.StartEvent.class::isInstance);
	}
}
