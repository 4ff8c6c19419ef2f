package org.texttechnologylab.nereval.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.texttechnologylab.nereval.NerEvaluation;
import org.texttechnologylab.nereval.engine.MetricsResult;
import org.texttechnologylab.nereval.record.EntityFilter;
import org.texttechnologylab.nereval.record.MalformedAnnotationException;
import org.texttechnologylab.nereval.report.MetricsReportPrinter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry point: evaluates NER predictions against a gold standard and prints the micro-averaged
 * precision, recall and F1 score.
 */
@Command(
		name = "ner-eval",
		description = "Evaluate NER model predictions against a gold standard.",
		mixinStandardHelpOptions = true,
		version = "1.0.0"
)
public class NerEvalCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger(NerEvalCommand.class);

	public static final int EXIT_MALFORMED_INPUT = 1;

	@Spec
	CommandSpec spec;

	@Option(
			names = {"--gold_standard"},
			required = true,
			description = "Path to the gold standard TSV file."
	)
	Path goldStandard;

	@Option(
			names = {"--predictions"},
			required = true,
			description = "Path to the predictions TSV file."
	)
	Path predictions;

	@Option(
			names = {"--entities"},
			arity = "1..*",
			paramLabel = "LABEL",
			description = "Only evaluate these entity labels. Values are upper-cased."
	)
	List<String> entities;

	@Option(
			names = {"--per_document"},
			paramLabel = "TARGET",
			description = "Also print per-document metrics to System.out, System.err or a file path."
	)
	String perDocumentTarget;

	@Option(
			names = {"-v", "--verbose"},
			description = "Enable verbose logging"
	)
	boolean verbose;

	public static void main(String[] args) {
		System.exit(new CommandLine(new NerEvalCommand()).execute(args));
	}

	@Override
	public Integer call() {
		if (verbose) {
			ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
			root.setLevel(Level.DEBUG);
		}

		MetricsResult result;
		try {
			result = new NerEvaluation(EntityFilter.of(entities)).evaluate(goldStandard, predictions);
		} catch (MalformedAnnotationException e) {
			logger.error("Evaluation failed: {}", e.getMessage());
			spec.commandLine().getErr().println("Error: " + e.getMessage());
			return EXIT_MALFORMED_INPUT;
		}

		MetricsReportPrinter printer = new MetricsReportPrinter();
		printer.printSummary(result, spec.commandLine().getOut());
		if (perDocumentTarget != null) {
			try {
				printer.printPerDocument(result, perDocumentTarget);
			} catch (IOException e) {
				logger.error("Could not write per-document metrics to {}: {}", perDocumentTarget, e.toString());
				return EXIT_MALFORMED_INPUT;
			}
		}
		return CommandLine.ExitCode.OK;
	}
}
