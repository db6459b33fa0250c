package org.javai.bpmncode.parser;

/**
 * Outcome of one grammar rule: the parsed value, or the error that stopped it.
 * <p>
 * Failures are ordinary values so the parser can try an alternative after rewinding without
 * unwinding the stack.
 */
public sealed interface ParseResult<T> {

	static <T> ParseResult<T> success(T value) {
		return new Success<>(value);
	}

	static <T> ParseResult<T> failure(ParserError error) {
		return new Failure<>(error);
	}

	default boolean isSuccess() {
		return this instanceof Success<T>;
	}

	default boolean isFailure() {
		return this instanceof Failure<T>;
	}

	/**
	 * The parsed value.
	 *
	 * @throws IllegalStateException if this is a failure
	 */
	default T value() {
		if (this instanceof Success<T> success) {
			return success.result();
		}
		throw new IllegalStateException("No value: " + error().message());
	}

	/**
	 * The error that stopped the rule.
	 *
	 * @throws IllegalStateException if this is a success
	 */
	default ParserError error() {
		if (this instanceof Failure<T> failure) {
			return failure.cause();
		}
		throw new IllegalStateException("Parse succeeded");
	}

	/**
	 * Re-types a failure so it can be returned from a rule producing a different type.
	 */
	default <U> ParseResult<U> propagate() {
		return new Failure<>(error());
	}

	record Success<T>(T result) implements ParseResult<T> {
	}

	record Failure<T>(ParserError cause) implements ParseResult<T> {
	}
}
