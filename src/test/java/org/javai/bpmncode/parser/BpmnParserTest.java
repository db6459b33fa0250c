package org.javai.bpmncode.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.javai.bpmncode.ast.AttributeValue;
import org.javai.bpmncode.ast.Document;
import org.javai.bpmncode.ast.EventType;
import org.javai.bpmncode.ast.Flow;
import org.javai.bpmncode.ast.FlowType;
import org.javai.bpmncode.ast.GatewayBranch;
import org.javai.bpmncode.ast.GatewayType;
import org.javai.bpmncode.ast.ImportDeclaration;
import org.javai.bpmncode.ast.ProcessDeclaration;
import org.javai.bpmncode.ast.ProcessElement;
import org.javai.bpmncode.ast.TaskType;
import org.javai.bpmncode.config.CheckerSettings;
import org.javai.bpmncode.diagnostics.Diagnostic;
import org.javai.bpmncode.diagnostics.DiagnosticKind;
import org.javai.bpmncode.diagnostics.Severity;
import org.javai.bpmncode.lexer.BpmnTokenizer;
import org.javai.bpmncode.lexer.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BpmnParserTest {

	private BpmnParser parser;

	@BeforeEach
	void setUp() {
		parser = new BpmnParser();
	}

	private Document parse(String source) {
		return parser.parseWithRecovery(BpmnTokenizer.tokenize(source, null));
	}

	private ProcessDeclaration onlyProcess(String source) {
		Document document = parse(source);
		assertThat(document.processes()).hasSize(1);
		return document.processes().get(0);
	}

	private static List<String> messages(Document document) {
		return document.errors().stream().map(Diagnostic::message).toList();
	}

	@Test
	void emptyInputGivesEmptyDocument() {
		Document document = parse("");

		assertThat(document.imports()).isEmpty();
		assertThat(document.processes()).isEmpty();
		assertThat(document.errors()).isEmpty();
	}

	@Test
	void tokensWithoutEofAreAccepted() {
		List<Token> tokens = BpmnTokenizer.tokenize("process P { start end }", null);
		Document document = parser.parseWithRecovery(tokens.subList(0, tokens.size() - 1));

		assertThat(document.processes()).hasSize(1);
		assertThat(document.errors()).isEmpty();
	}

	@Nested
	@DisplayName("Processes and elements")
	class ElementTests {

		@Test
		void singleLineProcess() {
			ProcessDeclaration process = onlyProcess("process P { start task T end }");

			assertThat(process.name()).isEqualTo("P");
			assertThat(process.elements()).hasSize(3);
			assertThat(process.elements().get(0)).isInstanceOf(ProcessElement.StartEvent.class);
			assertThat(process.elements().get(1)).isEqualTo(
					new ProcessElement.Task("T", TaskType.GENERIC, Map.of(),
							process.elements().get(1).span()));
			assertThat(process.elements().get(2)).isInstanceOf(ProcessElement.EndEvent.class);
		}

		@Test
		void singleLineProcessHasNoErrors() {
			assertThat(parse("process P { start task T end }").errors()).isEmpty();
		}

		@Test
		void taskFamily() {
			ProcessDeclaration process = onlyProcess("""
					process P {
						task A
						user B
						service C
						script D
					}
					""");

			assertThat(process.elements())
					.extracting(e -> ((ProcessElement.Task) e).taskType())
					.containsExactly(TaskType.GENERIC, TaskType.USER, TaskType.SERVICE, TaskType.SCRIPT);
		}

		@Test
		void exclusiveGatewayWithDefaultBranch() {
			ProcessDeclaration process = onlyProcess(
					"process P { start xor G? { [a] -> X [b] -> Y => Z } task X task Y task Z end }");

			ProcessElement.Gateway gateway = (ProcessElement.Gateway) process.elements().get(1);
			assertThat(gateway.id()).isEqualTo("G");
			assertThat(gateway.gatewayType()).isEqualTo(GatewayType.EXCLUSIVE);
			assertThat(gateway.branches()).hasSize(3);
			assertThat(gateway.branches()).extracting(GatewayBranch::target).containsExactly("X", "Y", "Z");

			GatewayBranch fallback = gateway.branches().get(2);
			assertThat(fallback.isDefault()).isTrue();
			assertThat(fallback.conditionText()).isEmpty();
			assertThat(gateway.branches().get(0).condition()).isEqualTo("a");
		}

		@Test
		void parallelGatewayWithShorthandBranchesAndEndTarget() {
			ProcessDeclaration process = onlyProcess("""
					process P {
						and Fork
						{
							left -> A
							right -> end
						}
					}
					""");

			ProcessElement.Gateway gateway = (ProcessElement.Gateway) process.elements().get(0);
			assertThat(gateway.gatewayType()).isEqualTo(GatewayType.PARALLEL);
			assertThat(gateway.branches()).extracting(GatewayBranch::condition).containsExactly("left", "right");
			assertThat(gateway.branches()).extracting(GatewayBranch::target).containsExactly("A", "end");
		}

		@Test
		void callActivityWithNamespace() {
			ProcessDeclaration process = onlyProcess("process P {\n call Billing::charge\n call Audit\n}");

			ProcessElement.CallActivity namespaced = (ProcessElement.CallActivity) process.elements().get(0);
			assertThat(namespaced.id()).isEqualTo("Billing");
			assertThat(namespaced.calledElement()).isEqualTo("Billing::charge");
			ProcessElement.CallActivity plain = (ProcessElement.CallActivity) process.elements().get(1);
			assertThat(plain.calledElement()).isEqualTo("Audit");
		}

		@Test
		void noteTextIsUnescaped() {
			ProcessDeclaration process = onlyProcess("process P {\n note \"say \\\"hi\\\"\\n\\\\done\"\n}");

			ProcessElement.Annotation note = (ProcessElement.Annotation) process.elements().get(0);
			assertThat(note.text()).isEqualTo("say \"hi\"\n\\done");
		}

		@Test
		void unknownEscapeIsKept() {
			assertThat(BpmnParser.unescape("\"a\\qb\"")).isEqualTo("a\\qb");
			assertThat(BpmnParser.unescape("\"plain\"")).isEqualTo("plain");
		}

		@Test
		void commentsBetweenStatementsAreIgnored() {
			ProcessDeclaration process = onlyProcess("""
					process P { // header
						start
						/* the only task */
						task A
						end
					}
					""");

			assertThat(process.elements()).hasSize(3);
		}
	}

	@Nested
	@DisplayName("Events")
	class EventTests {

		@Test
		void startAndEndEventTypes() {
			ProcessDeclaration process = onlyProcess("""
					process P {
						start @message "order received"
						end @terminate
					}
					""");

			ProcessElement.StartEvent start = (ProcessElement.StartEvent) process.elements().get(0);
			assertThat(start.eventType()).isEqualTo(new EventType.Message("order received"));
			ProcessElement.EndEvent end = (ProcessElement.EndEvent) process.elements().get(1);
			assertThat(end.eventType()).isEqualTo(new EventType.Terminate());
		}

		@Test
		void intermediateEvents() {
			ProcessDeclaration process = onlyProcess("""
					process P {
						event @timer 5m
						event @signal "restock" "payload"
						event @error "E42"
					}
					""");

			List<ProcessElement> events = process.elements();
			assertThat(((ProcessElement.IntermediateEvent) events.get(0)).eventType())
					.isEqualTo(new EventType.Timer("5m"));
			ProcessElement.IntermediateEvent signal = (ProcessElement.IntermediateEvent) events.get(1);
			assertThat(signal.eventType()).isEqualTo(new EventType.Signal("restock"));
			assertThat(signal.payload()).isEqualTo("payload");
			assertThat(((ProcessElement.IntermediateEvent) events.get(2)).eventType())
					.isEqualTo(new EventType.ErrorCode("E42"));
		}

		@Test
		void misspelledEventTypeSuggestsCorrection() {
			Document document = parse("process P {\n start @tmer 5m\n}");

			assertThat(document.processes().get(0).elements())
					.singleElement().isInstanceOf(ProcessElement.StartEvent.class);
			assertThat(document.errors()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.UNEXPECTED_TOKEN);
				assertThat(d.message()).startsWith("Unexpected token 'tmer', expected event type");
				assertThat(d.suggestions()).contains("timer");
			});
		}

		@Test
		void suggestionOnlyEventTypeIsRejected() {
			Document document = parse("process P {\n start @escalation\n}");

			assertThat(document.errors()).singleElement().satisfies(d ->
					assertThat(d.message()).startsWith("Unexpected token 'escalation', expected event type"));
		}

		@Test
		void intermediateEventWithoutTypeCannotBeRecovered() {
			Document document = parse("process P {\n event \"x\"\n}");

			assertThat(messages(document)).contains("Cannot recover from token 'event'");
			assertThat(document.processes().get(0).elements()).isEmpty();
		}
	}

	@Nested
	@DisplayName("Flows")
	class FlowTests {

		@Test
		void flowTypes() {
			ProcessDeclaration process = onlyProcess("""
					process P {
						A -> B
						B --> C
						G => D
						N ..> A
					}
					""");

			assertThat(process.flows()).extracting(Flow::flowType).containsExactly(
					FlowType.SEQUENCE, FlowType.MESSAGE, FlowType.DEFAULT, FlowType.ASSOCIATION);
		}

		@Test
		void startAndEndSentinels() {
			ProcessDeclaration process = onlyProcess("process P {\n start -> A\n A -> end\n}");

			assertThat(process.elements()).isEmpty();
			assertThat(process.flows()).extracting(Flow::from).containsExactly("start", "A");
			assertThat(process.flows()).extracting(Flow::to).containsExactly("A", "end");
		}

		@Test
		void conditionTextIsRebuilt() {
			ProcessDeclaration process = onlyProcess("""
					process P {
						A -> B [amount > 1000]
						A -> C [approved == true]
						A -> D [not shipped]
					}
					""");

			assertThat(process.flows()).extracting(Flow::condition).containsExactly(
					"amount> 1000", "approved== true", "not shipped");
		}

		@Test
		void longConditionIsCutOffAndReported() {
			List<String> words = IntStream.range(0, 51).mapToObj(i -> "c" + i).toList();
			Document document = parse("process P {\n start\n A -> B [" + String.join(" ", words) + "]\n}");

			assertThat(document.processes().get(0).flows()).singleElement().satisfies(flow ->
					assertThat(flow.condition()).isEqualTo(String.join(" ", words.subList(0, 50))));
			assertThat(messages(document)).first().isEqualTo("Unexpected token 'c50', expected ']'");
			assertThat(messages(document)).contains("Skipping unexpected token 'c50'");
		}

		@Test
		void unclosedConditionIsReported() {
			Document document = parse("process P {\n start\n A -> B [ok\n}");

			assertThat(document.processes().get(0).flows()).singleElement().satisfies(flow ->
					assertThat(flow.condition()).isEqualTo("ok"));
			assertThat(messages(document)).containsExactly("Unexpected token '}', expected ']'");
		}

		@Test
		void flowWithoutConditionHasNone() {
			Flow flow = onlyProcess("process P {\n A -> B\n}").flows().get(0);

			assertThat(flow.conditionText()).isEmpty();
			assertThat(flow).hasToString("A -> B");
		}

		@Test
		void missingFlowTargetGetsPlaceholder() {
			Document document = parse("process P {\n start\n A ->\n}");

			assertThat(document.processes().get(0).flows()).singleElement().satisfies(flow -> {
				assertThat(flow.from()).isEqualTo("A");
				assertThat(flow.to()).isEqualTo("UnknownTarget_8");
			});
			assertThat(messages(document)).containsExactly("Missing target in flow");
		}
	}

	@Nested
	@DisplayName("Attributes")
	class AttributeTests {

		@Test
		void parenthesizedAttributesWithoutCommas() {
			ProcessDeclaration process = onlyProcess("process P {\n task Foo (timeout=30s retries=3)\n}");

			ProcessElement.Task task = (ProcessElement.Task) process.elements().get(0);
			assertThat(task.attributes()).containsExactly(
					Map.entry("timeout", new AttributeValue.DurationValue("30s")),
					Map.entry("retries", new AttributeValue.NumberValue(3.0)));
		}

		@Test
		void durationSuffixes() {
			ProcessDeclaration process = onlyProcess(
					"process P {\n task Poll (interval=500ms, window=5m, timeout=2h)\n}");

			ProcessElement.Task task = (ProcessElement.Task) process.elements().get(0);
			assertThat(task.attributes()).containsExactly(
					Map.entry("interval", new AttributeValue.DurationValue("500ms")),
					Map.entry("window", new AttributeValue.DurationValue("5m")),
					Map.entry("timeout", new AttributeValue.DurationValue("2h")));
		}

		@Test
		void atAttributesOfEveryValueKind() {
			ProcessDeclaration process = onlyProcess(
					"process P {\n user Review @assignee \"bob\" @priority 2.5 @secure @form review @required false\n}");

			ProcessElement.Task task = (ProcessElement.Task) process.elements().get(0);
			assertThat(task.attributes())
					.containsEntry("assignee", new AttributeValue.StringValue("bob"))
					.containsEntry("priority", new AttributeValue.NumberValue(2.5))
					.containsEntry("secure", new AttributeValue.BooleanValue(true))
					.containsEntry("form", new AttributeValue.StringValue("review"))
					.containsEntry("required", new AttributeValue.BooleanValue(false));
		}

		@Test
		void repeatedKeyKeepsLastValue() {
			ProcessDeclaration process = onlyProcess("process P {\n task A @priority 1 (priority=3)\n}");

			ProcessElement.Task task = (ProcessElement.Task) process.elements().get(0);
			assertThat(task.attributes()).containsExactly(
					Map.entry("priority", new AttributeValue.NumberValue(3.0)));
		}

		@Test
		void keywordMayNameAnAttribute() {
			ProcessDeclaration process = onlyProcess("process P {\n task A @script \"run.groovy\"\n}");

			ProcessElement.Task task = (ProcessElement.Task) process.elements().get(0);
			assertThat(task.attributes()).containsEntry("script", new AttributeValue.StringValue("run.groovy"));
		}

		@Test
		void invalidNumberIsReportedAndElementKept() {
			Document document = parse("process P {\n task A @retries 3x\n}");

			assertThat(document.processes().get(0).elements()).singleElement().satisfies(element ->
					assertThat(element.declaredId()).contains("A"));
			assertThat(document.errors()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.INVALID_ATTRIBUTE_VALUE);
				assertThat(d.message()).isEqualTo("Invalid attribute value '3x'");
			});
		}

		@Test
		void processAttributes() {
			ProcessDeclaration process = onlyProcess("process P @version 2 @author \"ops\" {\n start\n}");

			assertThat(process.attributes())
					.containsEntry("version", new AttributeValue.NumberValue(2))
					.containsEntry("author", new AttributeValue.StringValue("ops"));
		}

		@Test
		void malformedProcessAttributesDoNotLoseTheBody() {
			Document document = parse("process P @ 42 {\n start\n}");

			assertThat(document.processes()).singleElement().satisfies(process ->
					assertThat(process.elements()).hasSize(1));
			assertThat(document.errors()).singleElement().satisfies(d ->
					assertThat(d.message()).isEqualTo("Unexpected token '42', expected attribute name"));
		}
	}

	@Nested
	@DisplayName("Imports")
	class ImportTests {

		@Test
		void pathWithAlias() {
			ImportDeclaration declaration = parse("import \"shared/billing.bpmn\" as billing").imports().get(0);

			assertThat(declaration.path()).isEqualTo("shared/billing.bpmn");
			assertThat(declaration.aliasName()).contains("billing");
			assertThat(declaration.items()).isEmpty();
		}

		@Test
		void namedItems() {
			Document document = parse("import Charge, Refund from \"billing.bpmn\"\nprocess P { start }");

			ImportDeclaration declaration = document.imports().get(0);
			assertThat(declaration.items()).containsExactly("Charge", "Refund");
			assertThat(declaration.path()).isEqualTo("billing.bpmn");
			assertThat(declaration.aliasName()).isEmpty();
			assertThat(document.processes()).hasSize(1);
			assertThat(document.errors()).isEmpty();
		}

		@Test
		void importWithoutFromIsReportedAndParsingContinues() {
			Document document = parse("import Charge \"billing.bpmn\"\nprocess P { start }");

			assertThat(document.imports()).isEmpty();
			assertThat(document.processes()).hasSize(1);
			assertThat(messages(document)).containsExactly("Unexpected token '\"billing.bpmn\"', expected 'from'");
		}
	}

	@Nested
	@DisplayName("Containers")
	class ContainerTests {

		@Test
		void subprocessWithOwnFlows() {
			ProcessDeclaration process = onlyProcess("""
					process P {
						subprocess Fulfil @collapsed {
							start -> Pack
							task Pack
						}
					}
					""");

			ProcessElement.Subprocess subprocess = (ProcessElement.Subprocess) process.elements().get(0);
			assertThat(subprocess.id()).isEqualTo("Fulfil");
			assertThat(subprocess.attributes()).containsEntry("collapsed", new AttributeValue.BooleanValue(true));
			assertThat(subprocess.elements()).hasSize(1);
			assertThat(subprocess.flows()).extracting(Flow::to).containsExactly("Pack");
		}

		@Test
		void poolWithLanesAndFlows() {
			ProcessDeclaration process = onlyProcess("""
					process P {
						pool Shop {
							lane Sales {
								task Quote
							}
							lane Warehouse {
								task Ship
							}
							Quote -> Ship
						}
					}
					""");

			ProcessElement.Pool pool = (ProcessElement.Pool) process.elements().get(0);
			assertThat(pool.name()).isEqualTo("Shop");
			assertThat(pool.lanes()).extracting(lane -> lane.name()).containsExactly("Sales", "Warehouse");
			assertThat(pool.lanes().get(1).elements()).singleElement().satisfies(element ->
					assertThat(element.declaredId()).contains("Ship"));
			assertThat(pool.flows()).singleElement().hasToString("Quote -> Ship");
		}

		@Test
		void groupHoldsElements() {
			ProcessDeclaration process = onlyProcess("process P {\n group \"Checks\" {\n task A\n task B\n }\n}");

			ProcessElement.Group group = (ProcessElement.Group) process.elements().get(0);
			assertThat(group.label()).isEqualTo("Checks");
			assertThat(group.elements()).hasSize(2);
			assertThat(group.declaredId()).isEmpty();
		}

		@Test
		void unclosedProcessKeepsWhatWasRead() {
			Document document = parse("process P {\n start\n task A");

			assertThat(document.processes().get(0).elements()).hasSize(2);
			assertThat(document.errors()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.UNCLOSED_BLOCK);
				assertThat(d.message()).isEqualTo("Missing closing brace for process");
			});
		}

		@Test
		void unclosedSubprocessIsNamed() {
			Document document = parse("process P {\n subprocess Inner {\n task A\n");

			assertThat(messages(document)).containsExactly(
					"Missing closing brace for subprocess 'Inner'",
					"Missing closing brace for process");
		}

		@Test
		void nestingBeyondLimitIsSkippedWithOneError() {
			BpmnParser shallow = new BpmnParser(CheckerSettings.defaults().withMaxNestingDepth(2));
			String source = "process P {\n subprocess A {\n subprocess B {\n subprocess C {\n task X\n }\n }\n }\n task After\n}";

			Document document = shallow.parseWithRecovery(BpmnTokenizer.tokenize(source, null));

			assertThat(messages(document)).containsExactly(
					"Nesting deeper than 2 levels; skipping subprocess 'C' body");
			ProcessDeclaration process = document.processes().get(0);
			assertThat(process.elements()).extracting(e -> e.declaredId().orElseThrow())
					.containsExactly("A", "After");
		}

		@Test
		void skippedBodyWithoutClosingBraceIsReported() {
			BpmnParser shallow = new BpmnParser(CheckerSettings.defaults().withMaxNestingDepth(1));
			String source = "process P {\n subprocess A {\n subprocess B {\n task X\n";

			Document document = shallow.parseWithRecovery(BpmnTokenizer.tokenize(source, null));

			assertThat(messages(document)).containsExactly(
					"Nesting deeper than 1 levels; skipping subprocess 'B' body",
					"Missing closing brace for subprocess 'B'",
					"Missing closing brace for subprocess 'A'",
					"Missing closing brace for process");
		}

		@Test
		void pathologicalNestingDoesNotOverflow() {
			StringBuilder source = new StringBuilder("process P {\n");
			for (int i = 0; i < 200; i++) {
				source.append("subprocess S").append(i).append(" {\n");
			}
			source.append("}\n".repeat(201));

			Document document = parse(source.toString());

			assertThat(document.errors()).singleElement().satisfies(d ->
					assertThat(d.message()).startsWith("Nesting deeper than 64 levels"));
		}
	}

	@Nested
	@DisplayName("Recovery")
	class RecoveryTests {

		@Test
		void missingTaskIdentifierUsesPlaceholder() {
			Document document = parse("process P {\n start\n task\n end\n}");

			assertThat(document.processes().get(0).elements()).extracting(e -> e.declaredId().orElse(null))
					.containsExactly(null, "Task_6", null);
			assertThat(document.errors()).singleElement().satisfies(d -> {
				assertThat(d.severity()).isEqualTo(Severity.WARNING);
				assertThat(d.kind()).isEqualTo(DiagnosticKind.MISSING_ELEMENT);
			});
			assertThat(document.hasErrors()).isFalse();
		}

		@Test
		void gatewayWithoutBlock() {
			Document document = parse("process P {\n start\n xor G\n end\n}");

			assertThat(document.processes().get(0).elements()).hasSize(3);
			assertThat(messages(document)).containsExactly("Gateway missing branches block");
		}

		@Test
		void branchWithoutArrowIsDropped() {
			Document document = parse("process P {\n xor G {\n [a] X\n [b] -> Y\n }\n}");

			ProcessElement.Gateway gateway = (ProcessElement.Gateway) document.processes().get(0).elements().get(0);
			assertThat(gateway.branches()).extracting(GatewayBranch::target).containsExactly("Y");
			assertThat(messages(document)).containsExactly("Missing arrow in gateway branch");
		}

		@Test
		void unrecoverableTokenIsSkipped() {
			Document document = parse("process P {\n start\n 42\n end\n}");

			assertThat(document.processes().get(0).elements()).hasSize(2);
			assertThat(document.errors()).extracting(Diagnostic::severity, Diagnostic::message).containsExactly(
					tuple(Severity.ERROR, "Cannot recover from token '42'"),
					tuple(Severity.WARNING, "Skipping unexpected token '42'"));
		}

		@Test
		void strayTokensBeforeProcessAreReportedOnce() {
			Document document = parse("hello world\nprocess P { start }");

			assertThat(document.processes()).hasSize(1);
			assertThat(messages(document)).containsExactly("Unexpected token 'hello'");
		}

		@Test
		void strayBraceBetweenProcesses() {
			Document document = parse("process P { start }\n}\nprocess Q { start }");

			assertThat(document.processes()).extracting(ProcessDeclaration::name).containsExactly("P", "Q");
			assertThat(messages(document)).containsExactly("Unexpected token '}'");
		}

		@Test
		void brokenProcessHeaderResumesAtNextProcess() {
			Document document = parse("process {\n start\n}\nprocess Q {\n start\n}");

			assertThat(document.processes()).extracting(ProcessDeclaration::name).containsExactly("Q");
			assertThat(document.errors()).first().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.UNEXPECTED_TOKEN);
				assertThat(d.message()).isEqualTo("Unexpected token '{', expected identifier");
			});
		}

		@Test
		void misspelledProcessKeywordSkipsToNextProcess() {
			Document document = parse("proces P { start end }\nprocess Q { start }");

			assertThat(document.processes()).extracting(ProcessDeclaration::name).containsExactly("Q");
			assertThat(document.errors()).singleElement().satisfies(d ->
					assertThat(d.suggestions()).contains("process"));
		}

		@Test
		void garbageInputTerminates() {
			Document document = parse("} } ] -> => @ ( \"x 42 $ \n process { { ( [ task xor ? :: ..>");

			assertThat(document).isNotNull();
			assertThat(document.hasErrors()).isTrue();
		}

		@Test
		void parsingIsDeterministic() {
			String source = "process P {\n start @tmer\n task\n xor G [a] -> X\n A ->\n 42\n}\nproces Q {}";

			assertThat(parse(source)).isEqualTo(parse(source));
		}
	}
}
