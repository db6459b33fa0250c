package org.javai.bpmncode.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.bpmncode.lexer.Span;

/**
 * A node inside a process body.
 * <p>
 * Containers ({@link Subprocess}, {@link Pool}, {@link Group}) own their children directly; there
 * are no back-references to the parent.
 */
public sealed interface ProcessElement {

	Span span();

	/**
	 * The identifier this element declares in its container's scope, if any.
	 */
	default Optional<String> declaredId() {
		return Optional.empty();
	}

	<R> R accept(ProcessElementVisitor<R> visitor);

	record StartEvent(String id, EventType eventType, Map<String, AttributeValue> attributes, Span span)
			implements ProcessElement {

		public StartEvent {
			attributes = copyAttributes(attributes);
		}

		@Override
		public Optional<String> declaredId() {
			return Optional.ofNullable(id);
		}

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitStartEvent(this);
		}
	}

	record EndEvent(String id, EventType eventType, Map<String, AttributeValue> attributes, Span span)
			implements ProcessElement {

		public EndEvent {
			attributes = copyAttributes(attributes);
		}

		@Override
		public Optional<String> declaredId() {
			return Optional.ofNullable(id);
		}

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitEndEvent(this);
		}
	}

	record Task(String id, TaskType taskType, Map<String, AttributeValue> attributes, Span span)
			implements ProcessElement {

		public Task {
			attributes = copyAttributes(attributes);
		}

		@Override
		public Optional<String> declaredId() {
			return Optional.of(id);
		}

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitTask(this);
		}
	}

	record Gateway(String id, GatewayType gatewayType, List<GatewayBranch> branches, Span span)
			implements ProcessElement {

		public Gateway {
			branches = List.copyOf(branches);
		}

		@Override
		public Optional<String> declaredId() {
			return Optional.ofNullable(id);
		}

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitGateway(this);
		}
	}

	record IntermediateEvent(String id, EventType eventType, String payload, Map<String, AttributeValue> attributes,
			Span span) implements ProcessElement {

		public IntermediateEvent {
			attributes = copyAttributes(attributes);
		}

		@Override
		public Optional<String> declaredId() {
			return Optional.ofNullable(id);
		}

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitIntermediateEvent(this);
		}
	}

	record Subprocess(String id, List<ProcessElement> elements, List<Flow> flows,
			Map<String, AttributeValue> attributes, Span span) implements ProcessElement {

		public Subprocess {
			elements = List.copyOf(elements);
			flows = List.copyOf(flows);
			attributes = copyAttributes(attributes);
		}

		@Override
		public Optional<String> declaredId() {
			return Optional.of(id);
		}

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitSubprocess(this);
		}
	}

	/**
	 * {@code call id} or {@code call ns::id}; {@code calledElement} is the full, possibly
	 * namespaced, name.
	 */
	record CallActivity(String id, String calledElement, Map<String, AttributeValue> attributes, Span span)
			implements ProcessElement {

		public CallActivity {
			attributes = copyAttributes(attributes);
		}

		@Override
		public Optional<String> declaredId() {
			return Optional.of(id);
		}

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitCallActivity(this);
		}
	}

	record Pool(String name, List<Lane> lanes, List<ProcessElement> elements, List<Flow> flows, Span span)
			implements ProcessElement {

		public Pool {
			lanes = List.copyOf(lanes);
			elements = List.copyOf(elements);
			flows = List.copyOf(flows);
		}

		@Override
		public Optional<String> declaredId() {
			return Optional.of(name);
		}

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitPool(this);
		}
	}

	record Group(String label, List<ProcessElement> elements, Span span) implements ProcessElement {

		public Group {
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitGroup(this);
		}
	}

	record Annotation(String text, Span span) implements ProcessElement {

		@Override
		public <R> R accept(ProcessElementVisitor<R> visitor) {
			return visitor.visitAnnotation(this);
		}
	}

	/**
	 * Unmodifiable copy that keeps declaration order.
	 */
	static Map<String, AttributeValue> copyAttributes(Map<String, AttributeValue> attributes) {
		if (attributes == null || attributes.isEmpty()) {
			return Map.of();
		}
		return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}
}
