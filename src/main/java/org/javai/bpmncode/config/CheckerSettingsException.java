package org.javai.bpmncode.config;

/**
 * Exception thrown when checker settings cannot be read or are invalid.
 */
public class CheckerSettingsException extends RuntimeException {

	public CheckerSettingsException(String message) {
		super(message);
	}

	public CheckerSettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
