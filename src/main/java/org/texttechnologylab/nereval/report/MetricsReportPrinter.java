package org.texttechnologylab.nereval.report;

import com.google.common.base.Preconditions;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.texttechnologylab.nereval.engine.MetricsResult;
import org.texttechnologylab.nereval.engine.PositiveCounts;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Prints {@link MetricsResult MetricsResults}: the micro-averaged summary and, optionally, a delimited table with one
 * row per gold document.
 */
public class MetricsReportPrinter {
	private static final Logger logger = LoggerFactory.getLogger(MetricsReportPrinter.class);

	public static final String SYSTEM_OUT = "System.out";
	public static final String SYSTEM_ERR = "System.err";

	protected CSVFormat csvFormat = CSVFormat.DEFAULT
			.withCommentMarker('#')
			.withDelimiter(';')
			.withHeader("document", "precision", "recall", "f1", "tp", "predicted", "gold");

	public void printSummary(@Nonnull MetricsResult result, @Nonnull PrintWriter out) {
		out.println("Micro-average Precision: " + result.getMicroPrecision());
		out.println("Micro-average Recall: " + result.getMicroRecall());
		out.println("Micro-average F1 score: " + result.getMicroF1());
		out.flush();
	}

	/**
	 * Print the per-document table to the given target.
	 *
	 * @param targetLocation {@link #SYSTEM_OUT}, {@link #SYSTEM_ERR} or a file path. Missing parent directories are
	 *                       created, an existing file is overwritten.
	 */
	public void printPerDocument(@Nonnull MetricsResult result, @Nonnull String targetLocation) throws IOException {
		Preconditions.checkNotNull(targetLocation, "targetLocation");
		switch (targetLocation) {
			case SYSTEM_OUT:
				printPerDocument(result, new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
				break;
			case SYSTEM_ERR:
				printPerDocument(result, new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8)));
				break;
			default:
				File targetFile = new File(targetLocation);
				try (Writer writer = new OutputStreamWriter(FileUtils.openOutputStream(targetFile), StandardCharsets.UTF_8)) {
					printPerDocument(result, writer);
				}
				logger.info("Wrote per-document metrics for {} documents to {}.", result.getDocumentIds().size(), targetFile.getAbsolutePath());
		}
	}

	/**
	 * Print the per-document table to the given writer, which is flushed but not closed.
	 */
	public void printPerDocument(@Nonnull MetricsResult result, @Nonnull Writer writer) throws IOException {
		PositiveCounts counts = result.getCounts();
		CSVPrinter csvPrinter = new CSVPrinter(writer, csvFormat);
		for (String documentId : result.getDocumentIds()) {
			csvPrinter.printRecord(
					documentId,
					result.getPrecisionPerDocument().get(documentId),
					result.getRecallPerDocument().get(documentId),
					result.getF1PerDocument().get(documentId),
					counts.getTruePositivesPerDoc().getOrDefault(documentId, 0L),
					counts.getPredictedPositivesPerDoc().getOrDefault(documentId, 0L),
					counts.getGoldPositivesPerDoc().getOrDefault(documentId, 0L)
			);
		}
		csvPrinter.printComment(String.format("micro-average: precision=%s recall=%s f1=%s tp=%d predicted=%d gold=%d",
				result.getMicroPrecision(), result.getMicroRecall(), result.getMicroF1(),
				counts.getTruePositives(), counts.getPredictedPositives(), counts.getGoldPositives()));
		csvPrinter.flush();
	}
}
