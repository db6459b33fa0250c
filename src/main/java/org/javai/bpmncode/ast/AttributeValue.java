package org.javai.bpmncode.ast;

/**
 * Value of an element or process attribute.
 */
public sealed interface AttributeValue {

	/**
	 * Text form of the value as it would appear in source, without quotes.
	 */
	String asText();

	record StringValue(String value) implements AttributeValue {
		@Override
		public String asText() {
			return value;
		}
	}

	record NumberValue(double value) implements AttributeValue {
		@Override
		public String asText() {
			return value == Math.rint(value) && !Double.isInfinite(value)
					? String.valueOf((long) value)
					: String.valueOf(value);
		}
	}

	record BooleanValue(boolean value) implements AttributeValue {
		@Override
		public String asText() {
			return String.valueOf(value);
		}
	}

	/**
	 * Unit-suffixed number kept verbatim, e.g. {@code 30s} or {@code 500ms}.
	 */
	record DurationValue(String text) implements AttributeValue {
		@Override
		public String asText() {
			return text;
		}
	}
}
