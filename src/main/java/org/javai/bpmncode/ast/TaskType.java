package org.javai.bpmncode.ast;

public enum TaskType {
	GENERIC,
	USER,
	SERVICE,
	SCRIPT
}
