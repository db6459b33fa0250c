package org.javai.bpmncode.lexer;

import java.nio.file.Path;

/**
 * Source position attached to every token, AST node and diagnostic.
 *
 * @param start UTF-16 index of the first character in the source string (inclusive), not a byte offset
 * @param end UTF-16 index after the last character (exclusive)
 * @param line 1-based line number
 * @param column 1-based column, counted in code points
 * @param file the file the text came from
 */
public record Span(int start, int end, int line, int column, Path file) {

	public static final Path UNKNOWN_FILE = Path.of("");

	public Span {
		if (file == null) {
			file = UNKNOWN_FILE;
		}
	}

	/**
	 * Returns a span covering this span's start through {@code other}'s end, keeping this
	 * span's line and column.
	 */
	public Span through(Span other) {
		return new Span(start, other.end(), line, column, file);
	}

	public int length() {
		return end - start;
	}

	@Override
	public String toString() {
		return file + ":" + line + ":" + column;
	}
}
