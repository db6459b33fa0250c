package org.javai.bpmncode.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for walking element trees with visitors.
 */
public final class ProcessElementWalker {

	private ProcessElementWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits {@code element} and then, depth first, every element nested in it: subprocess
	 * bodies, pool bodies followed by their lanes, and group members.
	 *
	 * @return the result of visiting the root element
	 */
	public static <R> R walkPreOrder(ProcessElement element, ProcessElementVisitor<R> visitor) {
		if (element == null) {
			return null;
		}

		R result = element.accept(visitor);
		walkAll(children(element), visitor);
		return result;
	}

	/**
	 * Walks a list of sibling elements in order.
	 */
	public static <R> void walkAll(List<ProcessElement> elements, ProcessElementVisitor<R> visitor) {
		if (elements == null) {
			return;
		}

		for (ProcessElement element : elements) {
			walkPreOrder(element, visitor);
		}
	}

	/**
	 * Walks every element of every process in the document.
	 */
	public static <R> void walkDocument(Document document, ProcessElementVisitor<R> visitor) {
		for (ProcessDeclaration process : document.processes()) {
			walkAll(process.elements(), visitor);
		}
	}

	/**
	 * Direct children of a container element, lane members included; empty for leaves.
	 */
	public static List<ProcessElement> children(ProcessElement element) {
		if (element instanceof ProcessElement.Subprocess subprocess) {
			return subprocess.elements();
		}
		if (element instanceof ProcessElement.Group group) {
			return group.elements();
		}
		if (element instanceof ProcessElement.Pool pool) {
			if (pool.lanes().isEmpty()) {
				return pool.elements();
			}
			List<ProcessElement> all = new ArrayList<>(pool.elements());
			for (Lane lane : pool.lanes()) {
				all.addAll(lane.elements());
			}
			return all;
		}
		return List.of();
	}
}
