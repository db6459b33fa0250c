package org.javai.bpmncode.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import org.javai.bpmncode.lexer.Span;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProcessElementWalkerTest {

	private static final Span SPAN = new Span(0, 0, 1, 1, null);

	@Mock
	private ProcessElementVisitor<String> visitor;

	private static ProcessElement.Task task(String id) {
		return new ProcessElement.Task(id, TaskType.GENERIC, Map.of(), SPAN);
	}

	@Test
	void visitsContainerBeforeChildren() {
		ProcessElement.Task inner = task("Inner");
		ProcessElement.Annotation note = new ProcessElement.Annotation("check", SPAN);
		ProcessElement.Group group = new ProcessElement.Group("g", List.of(note), SPAN);
		ProcessElement.Subprocess subprocess = new ProcessElement.Subprocess("S", List.of(inner, group), List.of(),
				Map.of(), SPAN);
		when(visitor.visitSubprocess(subprocess)).thenReturn("root");

		String result = ProcessElementWalker.walkPreOrder(subprocess, visitor);

		assertThat(result).isEqualTo("root");
		InOrder order = inOrder(visitor);
		order.verify(visitor).visitSubprocess(subprocess);
		order.verify(visitor).visitTask(inner);
		order.verify(visitor).visitGroup(group);
		order.verify(visitor).visitAnnotation(note);
		verifyNoMoreInteractions(visitor);
	}

	@Test
	void poolBodyComesBeforeLanes() {
		ProcessElement.Task own = task("Own");
		ProcessElement.Task sales = task("Sales");
		ProcessElement.Task ops = task("Ops");
		ProcessElement.Pool pool = new ProcessElement.Pool("Shop",
				List.of(new Lane("S", List.of(sales), SPAN), new Lane("O", List.of(ops), SPAN)),
				List.of(own), List.of(), SPAN);

		assertThat(ProcessElementWalker.children(pool)).containsExactly(own, sales, ops);

		ProcessElementWalker.walkPreOrder(pool, visitor);

		InOrder order = inOrder(visitor);
		order.verify(visitor).visitPool(pool);
		order.verify(visitor).visitTask(own);
		order.verify(visitor).visitTask(sales);
		order.verify(visitor).visitTask(ops);
	}

	@Test
	void leavesHaveNoChildren() {
		assertThat(ProcessElementWalker.children(task("A"))).isEmpty();
		assertThat(ProcessElementWalker.children(new ProcessElement.Annotation("n", SPAN))).isEmpty();
	}

	@Test
	void nullRootIsIgnored() {
		assertThat(ProcessElementWalker.walkPreOrder(null, visitor)).isNull();
		ProcessElementWalker.walkAll(null, visitor);

		verify(visitor, never()).visitTask(any());
	}

	@Test
	void walksEveryProcessOfADocument() {
		ProcessElement.Task first = task("A");
		ProcessElement.Task second = task("B");
		Document document = new Document(List.of(), List.of(
				new ProcessDeclaration("P", Map.of(), List.of(first), List.of(), SPAN),
				new ProcessDeclaration("Q", Map.of(), List.of(second), List.of(), SPAN)),
				List.of());

		ProcessElementWalker.walkDocument(document, visitor);

		InOrder order = inOrder(visitor);
		order.verify(visitor).visitTask(first);
		order.verify(visitor).visitTask(second);
	}
}
