package org.javai.bpmncode.ast;

/**
 * Exclusive ({@code xor}, one branch taken) or parallel ({@code and}, all branches taken).
 */
public enum GatewayType {
	EXCLUSIVE,
	PARALLEL
}
