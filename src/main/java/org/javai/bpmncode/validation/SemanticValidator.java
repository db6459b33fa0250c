package org.javai.bpmncode.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.bpmncode.ast.Document;
import org.javai.bpmncode.ast.Flow;
import org.javai.bpmncode.ast.Lane;
import org.javai.bpmncode.ast.ProcessDeclaration;
import org.javai.bpmncode.ast.ProcessElement;
import org.javai.bpmncode.ast.ProcessElementVisitor;
import org.javai.bpmncode.diagnostics.Diagnostic;
import org.javai.bpmncode.diagnostics.DiagnosticKind;
import org.javai.bpmncode.diagnostics.Severity;
import org.javai.bpmncode.diagnostics.SuggestionEngine;
import org.javai.bpmncode.lexer.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a parsed document for problems the grammar cannot see: duplicate ids, flows whose
 * endpoints do not exist, and processes without a start event.
 * <p>
 * Ids are scoped to their direct container. The process top level and each subprocess, pool,
 * lane and group body is its own scope, and scopes never merge. A container's own id lives in its
 * parent's scope. Flows are resolved in the scope of the container they are written in; a pool's
 * flows may also name elements of its lanes. {@code start} as a source and {@code end} as a
 * target always resolve.
 */
public class SemanticValidator {

	private static final Logger logger = LoggerFactory.getLogger(SemanticValidator.class);

	static final String START_SENTINEL = "start";
	static final String END_SENTINEL = "end";

	private final SuggestionEngine suggestions;

	public SemanticValidator(SuggestionEngine suggestions) {
		if (suggestions == null) {
			throw new IllegalArgumentException("SuggestionEngine cannot be null");
		}
		this.suggestions = suggestions;
	}

	public SemanticValidator() {
		this(SuggestionEngine.withDefaults());
	}

	public ValidationResult validateSemantics(Document document) {
		if (document == null) {
			throw new IllegalArgumentException("Document cannot be null");
		}

		List<Diagnostic> diagnostics = new ArrayList<>();
		for (ProcessDeclaration process : document.processes()) {
			validateProcess(process, diagnostics);
		}

		logger.debug("Semantic validation of {} process(es) found {} problem(s)",
				document.processes().size(), diagnostics.size());
		return ValidationResult.of(diagnostics);
	}

	private void validateProcess(ProcessDeclaration process, List<Diagnostic> diagnostics) {
		Set<String> processIds = DeclaredIdCollector.collect(process.elements());

		Scope scope = new Scope(diagnostics, processIds);
		scope.declareAll(process.elements());
		scope.checkFlows(process.flows(), List.of());

		if (!process.hasStartEvent()) {
			diagnostics.add(Diagnostic.warning(DiagnosticKind.MISSING_ELEMENT,
					"Process '" + process.name() + "' must contain at least one start event", process.span()));
		}
	}

	/**
	 * Ids declared in one container, plus the checks that run against them. Visiting an element
	 * declares it here; visiting a container also validates the container's own body.
	 */
	private final class Scope implements ProcessElementVisitor<Void> {

		private final List<Diagnostic> diagnostics;
		private final Set<String> processIds;
		private final Map<String, Span> declared = new LinkedHashMap<>();

		Scope(List<Diagnostic> diagnostics, Set<String> processIds) {
			this.diagnostics = diagnostics;
			this.processIds = processIds;
		}

		void declareAll(List<ProcessElement> elements) {
			for (ProcessElement element : elements) {
				element.accept(this);
			}
		}

		private Void declare(ProcessElement element) {
			element.declaredId().ifPresent(id -> {
				if (declared.containsKey(id)) {
					diagnostics.add(Diagnostic.error(DiagnosticKind.DUPLICATE_ID,
							"Duplicate node id '" + id + "'", element.span()));
				} else {
					declared.put(id, element.span());
				}
			});
			return null;
		}

		/**
		 * Resolves each flow against this scope and any {@code extra} scopes.
		 */
		void checkFlows(List<Flow> flows, List<Scope> extra) {
			Set<String> known = new LinkedHashSet<>(declared.keySet());
			for (Scope scope : extra) {
				known.addAll(scope.declared.keySet());
			}

			for (Flow flow : flows) {
				boolean sourceKnown = START_SENTINEL.equals(flow.from()) || known.contains(flow.from());
				if (!sourceKnown) {
					diagnostics.add(unknownEndpoint("source", flow.from(), flow.span(), known));
				}
				if (!END_SENTINEL.equals(flow.to()) && !known.contains(flow.to())) {
					diagnostics.add(unknownEndpoint("target", flow.to(), flow.span(), known));
				}
				checkFlowType(flow, sourceKnown);
			}
		}

		private void checkFlowType(Flow flow, boolean sourceKnown) {
			switch (flow.flowType()) {
				case DEFAULT -> {
					if (!sourceKnown) {
						diagnostics.add(Diagnostic.error(DiagnosticKind.INVALID_FLOW,
								"The default arrow can only come from the gateway: " + flow, flow.span()));
					}
				}
				case SEQUENCE, MESSAGE, ASSOCIATION -> {
					// No further rules for these arrows yet
				}
			}
		}

		private Diagnostic unknownEndpoint(String role, String id, Span span, Collection<String> known) {
			List<String> candidates = suggestions.suggestIdentifiers(id, known);
			if (candidates.isEmpty()) {
				candidates = suggestions.suggestIdentifiers(id, processIds);
			}
			return new Diagnostic(DiagnosticKind.UNDEFINED_REFERENCE,
					"Unknown flow " + role + ": '" + id + "'", span, Severity.ERROR, candidates);
		}

		@Override
		public Void visitStartEvent(ProcessElement.StartEvent event) {
			return declare(event);
		}

		@Override
		public Void visitEndEvent(ProcessElement.EndEvent event) {
			return declare(event);
		}

		@Override
		public Void visitTask(ProcessElement.Task task) {
			return declare(task);
		}

		@Override
		public Void visitGateway(ProcessElement.Gateway gateway) {
			return declare(gateway);
		}

		@Override
		public Void visitIntermediateEvent(ProcessElement.IntermediateEvent event) {
			return declare(event);
		}

		@Override
		public Void visitCallActivity(ProcessElement.CallActivity callActivity) {
			return declare(callActivity);
		}

		@Override
		public Void visitAnnotation(ProcessElement.Annotation annotation) {
			return null;
		}

		@Override
		public Void visitGroup(ProcessElement.Group group) {
			new Scope(diagnostics, processIds).declareAll(group.elements());
			return null;
		}

		@Override
		public Void visitSubprocess(ProcessElement.Subprocess subprocess) {
			declare(subprocess);

			Scope body = new Scope(diagnostics, processIds);
			body.declareAll(subprocess.elements());
			body.checkFlows(subprocess.flows(), List.of());
			return null;
		}

		@Override
		public Void visitPool(ProcessElement.Pool pool) {
			declare(pool);

			Scope body = new Scope(diagnostics, processIds);
			body.declareAll(pool.elements());

			List<Scope> laneScopes = new ArrayList<>();
			for (Lane lane : pool.lanes()) {
				Scope laneScope = new Scope(diagnostics, processIds);
				laneScope.declareAll(lane.elements());
				laneScopes.add(laneScope);
			}

			body.checkFlows(pool.flows(), laneScopes);
			return null;
		}
	}
}
