package org.javai.bpmncode.diagnostics;

import java.util.Locale;

public enum Severity {
	ERROR,
	WARNING,
	INFO,
	HINT;

	public boolean isError() {
		return this == ERROR;
	}

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
