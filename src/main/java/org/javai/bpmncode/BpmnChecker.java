package org.javai.bpmncode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.javai.bpmncode.ast.Document;
import org.javai.bpmncode.config.CheckerSettings;
import org.javai.bpmncode.config.CheckerSettingsLoader;
import org.javai.bpmncode.diagnostics.ContextValidator;
import org.javai.bpmncode.diagnostics.Diagnostic;
import org.javai.bpmncode.diagnostics.DiagnosticReport;
import org.javai.bpmncode.diagnostics.SuggestionEngine;
import org.javai.bpmncode.lexer.BpmnTokenizer;
import org.javai.bpmncode.lexer.Token;
import org.javai.bpmncode.parser.BpmnParser;
import org.javai.bpmncode.validation.SemanticValidator;
import org.javai.bpmncode.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole front end over BPMNCode sources: tokenize, context validation, parsing with
 * recovery, then semantic validation.
 * <p>
 * Example usage:
 *
 * <pre>
 * BpmnChecker checker = new BpmnChecker();
 * CheckSummary summary = checker.checkAll(List.of(new Source(path, text)));
 * System.exit(summary.exitStatus());
 * </pre>
 */
public class BpmnChecker {

	private static final Logger logger = LoggerFactory.getLogger(BpmnChecker.class);

	private final ContextValidator contextValidator;
	private final BpmnParser parser;
	private final SemanticValidator semanticValidator;

	public BpmnChecker(CheckerSettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("Settings cannot be null");
		}
		SuggestionEngine suggestions = new SuggestionEngine(settings);
		this.contextValidator = new ContextValidator(suggestions);
		this.parser = new BpmnParser(settings);
		this.semanticValidator = new SemanticValidator(suggestions);
	}

	/**
	 * Uses the settings bundled on the class path.
	 */
	public BpmnChecker() {
		this(new CheckerSettingsLoader().loadDefault(BpmnChecker.class.getClassLoader()));
	}

	/**
	 * One source text to check.
	 *
	 * @param path where the text came from; used in spans only
	 * @param text the source text
	 */
	public record Source(Path path, String text) {
	}

	/**
	 * Everything produced for one source.
	 */
	public record CheckResult(List<Token> tokens, Document document, DiagnosticReport report) {
	}

	/**
	 * Reports for several sources and the exit status they add up to.
	 */
	public record CheckSummary(List<DiagnosticReport> reports) {

		public CheckSummary {
			reports = List.copyOf(reports);
		}

		public long errorCount() {
			return reports.stream().mapToLong(DiagnosticReport::errorCount).sum();
		}

		public long warningCount() {
			return reports.stream().mapToLong(DiagnosticReport::warningCount).sum();
		}

		public boolean hasErrors() {
			return errorCount() > 0;
		}

		/**
		 * 1 when any error was reported across all sources, else 0.
		 */
		public int exitStatus() {
			return hasErrors() ? 1 : 0;
		}
	}

	public CheckResult check(String source, Path path) {
		List<Token> tokens = BpmnTokenizer.tokenize(source, path);

		List<Diagnostic> diagnostics = new ArrayList<>(contextValidator.validateContext(tokens));
		Document document = parser.parseWithRecovery(tokens);
		diagnostics.addAll(document.errors());
		ValidationResult validation = semanticValidator.validateSemantics(document);
		diagnostics.addAll(validation.diagnostics());

		DiagnosticReport report = new DiagnosticReport(path, diagnostics);
		logger.debug("Checked {}: {} token(s), {} error(s), {} warning(s)",
				path, tokens.size(), report.errorCount(), report.warningCount());
		return new CheckResult(tokens, document, report);
	}

	/**
	 * Reads a UTF-8 file and checks it.
	 *
	 * @throws UncheckedIOException if the file cannot be read
	 */
	public CheckResult checkFile(Path path) {
		String source;
		try {
			source = Files.readString(path, StandardCharsets.UTF_8);
		} catch (IOException e) {
			logger.warn("Cannot read {}: {}", path, e.getMessage());
			throw new UncheckedIOException("Failed to read BPMNCode source: " + path, e);
		}
		return check(source, path);
	}

	public CheckSummary checkAll(Collection<Source> sources) {
		List<DiagnosticReport> reports = new ArrayList<>();
		for (Source source : sources) {
			reports.add(check(source.text(), source.path()).report());
		}
		return new CheckSummary(reports);
	}

	/**
	 * Reads and checks each file in turn; the first unreadable file stops the run.
	 */
	public CheckSummary checkFiles(Collection<Path> paths) {
		List<DiagnosticReport> reports = new ArrayList<>();
		for (Path path : paths) {
			reports.add(checkFile(path).report());
		}
		return new CheckSummary(reports);
	}
}
