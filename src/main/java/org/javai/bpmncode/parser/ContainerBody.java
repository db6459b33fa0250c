package org.javai.bpmncode.parser;

import java.util.List;
import org.javai.bpmncode.ast.Flow;
import org.javai.bpmncode.ast.Lane;
import org.javai.bpmncode.ast.ProcessElement;

/**
 * Contents of one {@code { ... }} block, returned by value to whichever node owns the block.
 *
 * @param elements elements in reading order
 * @param flows flows in reading order; always empty for lane and group bodies
 * @param lanes lanes in reading order; only pool bodies have any
 */
public record ContainerBody(List<ProcessElement> elements, List<Flow> flows, List<Lane> lanes) {

	public ContainerBody {
		elements = List.copyOf(elements);
		flows = List.copyOf(flows);
		lanes = List.copyOf(lanes);
	}

	public static ContainerBody empty() {
		return new ContainerBody(List.of(), List.of(), List.of());
	}
}
