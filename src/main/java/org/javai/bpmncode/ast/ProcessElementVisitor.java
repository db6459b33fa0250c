package org.javai.bpmncode.ast;

/**
 * Visitor over the {@link ProcessElement} variants.
 * <p>
 * Container visits receive the container itself; descending into children is left to the
 * visitor or to {@link ProcessElementWalker}.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ProcessElementVisitor<R> {

	R visitStartEvent(ProcessElement.StartEvent event);

	R visitEndEvent(ProcessElement.EndEvent event);

	R visitTask(ProcessElement.Task task);

	R visitGateway(ProcessElement.Gateway gateway);

	R visitIntermediateEvent(ProcessElement.IntermediateEvent event);

	R visitSubprocess(ProcessElement.Subprocess subprocess);

	R visitCallActivity(ProcessElement.CallActivity callActivity);

	R visitPool(ProcessElement.Pool pool);

	R visitGroup(ProcessElement.Group group);

	R visitAnnotation(ProcessElement.Annotation annotation);
}
