package org.javai.bpmncode.ast;

import java.util.Set;

/**
 * Trigger of a start, end or intermediate event, written {@code @message "payload"},
 * {@code @timer 5m}, {@code @error "code"}, {@code @signal "name"} or {@code @terminate}.
 */
public sealed interface EventType {

	/**
	 * Every type name the grammar accepts after {@code @} on an event.
	 */
	Set<String> TYPE_NAMES = Set.of("message", "timer", "error", "signal", "terminate");

	/**
	 * The keyword used after {@code @} in source.
	 */
	String typeName();

	record Message(String payload) implements EventType {
		@Override
		public String typeName() {
			return "message";
		}
	}

	record Timer(String duration) implements EventType {
		@Override
		public String typeName() {
			return "timer";
		}
	}

	record ErrorCode(String code) implements EventType {
		@Override
		public String typeName() {
			return "error";
		}
	}

	record Signal(String name) implements EventType {
		@Override
		public String typeName() {
			return "signal";
		}
	}

	record Terminate() implements EventType {
		@Override
		public String typeName() {
			return "terminate";
		}
	}
}
