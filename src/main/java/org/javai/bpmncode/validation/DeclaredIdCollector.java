package org.javai.bpmncode.validation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.javai.bpmncode.ast.ProcessElement;
import org.javai.bpmncode.ast.ProcessElementVisitor;
import org.javai.bpmncode.ast.ProcessElementWalker;

/**
 * Collects every id declared in an element tree, at any depth, in reading order.
 */
class DeclaredIdCollector implements ProcessElementVisitor<Void> {

	private final Set<String> ids = new LinkedHashSet<>();

	static Set<String> collect(List<ProcessElement> elements) {
		DeclaredIdCollector collector = new DeclaredIdCollector();
		ProcessElementWalker.walkAll(elements, collector);
		return collector.ids;
	}

	private Void add(ProcessElement element) {
		element.declaredId().ifPresent(ids::add);
		return null;
	}

	@Override
	public Void visitStartEvent(ProcessElement.StartEvent event) {
		return add(event);
	}

	@Override
	public Void visitEndEvent(ProcessElement.EndEvent event) {
		return add(event);
	}

	@Override
	public Void visitTask(ProcessElement.Task task) {
		return add(task);
	}

	@Override
	public Void visitGateway(ProcessElement.Gateway gateway) {
		return add(gateway);
	}

	@Override
	public Void visitIntermediateEvent(ProcessElement.IntermediateEvent event) {
		return add(event);
	}

	@Override
	public Void visitSubprocess(ProcessElement.Subprocess subprocess) {
		return add(subprocess);
	}

	@Override
	public Void visitCallActivity(ProcessElement.CallActivity callActivity) {
		return add(callActivity);
	}

	@Override
	public Void visitPool(ProcessElement.Pool pool) {
		return add(pool);
	}

	@Override
	public Void visitGroup(ProcessElement.Group group) {
		return null;
	}

	@Override
	public Void visitAnnotation(ProcessElement.Annotation annotation) {
		return null;
	}
}
