package org.texttechnologylab.nereval.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.jupiter.api.Test;
import org.texttechnologylab.nereval.record.AnnotationRecord;
import org.texttechnologylab.nereval.record.RecordNormalizer;
import org.texttechnologylab.nereval.record.RecordSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsEngineTest {

	private static final double DELTA = 1e-9;

	private final MetricsEngine engine = new MetricsEngine();
	private final RecordNormalizer normalizer = new RecordNormalizer();

	private static AnnotationRecord span(String document, String start, String end, String label) {
		return new AnnotationRecord(document, start, end, label, "");
	}

	private RecordSet records(AnnotationRecord... records) {
		return normalizer.normalizeRecords(Lists.newArrayList(records));
	}

	@Test
	public void testPartialPrediction() {
		RecordSet gold = records(span("doc1", "0", "5", "DISEASE"));
		RecordSet predicted = records(span("doc1", "0", "5", "DISEASE"), span("doc1", "10", "15", "DISEASE"));

		MetricsResult result = engine.computeMetrics(gold, predicted);
		PositiveCounts counts = result.getCounts();

		assertEquals(1, counts.getTruePositives());
		assertEquals(2, counts.getPredictedPositives());
		assertEquals(1, counts.getGoldPositives());
		assertEquals(0.5, result.getMicroPrecision(), DELTA);
		assertEquals(1.0, result.getMicroRecall(), DELTA);
		assertEquals(2.0 / 3.0, result.getMicroF1(), DELTA);

		assertEquals(0.5, result.getPrecisionPerDocument().get("doc1"), DELTA);
		assertEquals(1.0, result.getRecallPerDocument().get("doc1"), DELTA);
		assertEquals(2.0 / 3.0, result.getF1PerDocument().get("doc1"), DELTA);
	}

	@Test
	public void testSelfMatchIsPerfect() {
		RecordSet gold = records(
				span("doc1", "0", "5", "DISEASE"),
				span("doc1", "6", "9", "SYMPTOM"),
				span("doc2", "7", "12", "PROCEDURE")
		);

		MetricsResult result = engine.computeMetrics(gold, gold);

		assertEquals(1.0, result.getMicroPrecision(), DELTA);
		assertEquals(1.0, result.getMicroRecall(), DELTA);
		assertEquals(1.0, result.getMicroF1(), DELTA);
		for (String documentId : result.getDocumentIds()) {
			assertEquals(1.0, result.getF1PerDocument().get(documentId), DELTA);
		}
	}

	@Test
	public void testNoOverlap() {
		RecordSet gold = records(span("doc1", "0", "5", "DISEASE"), span("doc2", "1", "2", "DISEASE"));
		RecordSet predicted = records(span("doc1", "0", "6", "DISEASE"), span("doc2", "1", "2", "SYMPTOM"));

		MetricsResult result = engine.computeMetrics(gold, predicted);

		assertEquals(0, result.getCounts().getTruePositives());
		assertEquals(0.0, result.getMicroPrecision());
		assertEquals(0.0, result.getMicroRecall());
		assertEquals(0.0, result.getMicroF1());
	}

	@Test
	public void testLabelMismatchCountsAsPredictedPositiveOnly() {
		RecordSet gold = records(span("doc1", "0", "5", "DISEASE"));
		RecordSet predicted = records(span("doc1", "0", "5", "SYMPTOM"), span("doc1", "0", "5", "DISEASE"));

		PositiveCounts counts = engine.countPositives(gold, predicted);

		// Both predicted labels share a single position
		assertEquals(1, counts.getPredictedPositives());
		assertEquals(1, counts.getTruePositives());
	}

	@Test
	public void testGoldLabelsSharingASpanAreMatchedSeparately() {
		RecordSet gold = records(span("doc1", "0", "5", "DISEASE"), span("doc1", "0", "5", "SYMPTOM"));
		RecordSet predicted = records(span("doc1", "0", "5", "DISEASE"), span("doc1", "0", "5", "SYMPTOM"));

		PositiveCounts counts = engine.countPositives(gold, predicted);

		// Every matching gold record is a true positive, while positives count the shared span once
		assertEquals(2, counts.getTruePositives());
		assertEquals(1, counts.getPredictedPositives());
		assertEquals(1, counts.getGoldPositives());
	}

	@Test
	public void testEmptyPredictions() {
		RecordSet gold = records(span("doc1", "0", "5", "DISEASE"));

		MetricsResult result = engine.computeMetrics(gold, RecordSet.empty());

		assertEquals(0.0, result.getMicroPrecision());
		assertEquals(0.0, result.getMicroRecall());
		assertEquals(0.0, result.getMicroF1());
		assertTrue(Double.isNaN(result.getPrecisionPerDocument().get("doc1")));
		assertEquals(0.0, result.getRecallPerDocument().get("doc1"));
		assertTrue(Double.isNaN(result.getF1PerDocument().get("doc1")));
	}

	@Test
	public void testBothEmpty() {
		MetricsResult result = engine.computeMetrics(RecordSet.empty(), RecordSet.empty());

		assertEquals(0.0, result.getMicroPrecision());
		assertEquals(0.0, result.getMicroRecall());
		assertEquals(0.0, result.getMicroF1());
		assertTrue(result.getDocumentIds().isEmpty());
	}

	@Test
	public void testUnpredictedGoldDocumentHasZeroTruePositives() {
		RecordSet gold = records(span("doc1", "0", "5", "DISEASE"), span("doc2", "3", "9", "DISEASE"));
		RecordSet predicted = records(span("doc1", "0", "5", "DISEASE"));

		PositiveCounts counts = engine.countPositives(gold, predicted);

		assertEquals(0L, counts.getTruePositivesPerDoc().get("doc2"));
		assertEquals(1L, counts.getTruePositivesPerDoc().get("doc1"));
		assertFalse(counts.getPredictedPositivesPerDoc().containsKey("doc2"));

		MetricsResult result = engine.calculateMetrics(counts);
		assertTrue(Double.isNaN(result.getPrecisionPerDocument().get("doc2")));
		assertEquals(0.0, result.getRecallPerDocument().get("doc2"));
		assertEquals(0.5, result.getMicroRecall(), DELTA);
	}

	@Test
	public void testPredictedDocumentOutsideGoldIsExcludedPerDocument() {
		RecordSet gold = records(span("doc1", "0", "5", "DISEASE"));
		RecordSet predicted = records(span("doc1", "0", "5", "DISEASE"), span("doc9", "0", "5", "DISEASE"));

		MetricsResult result = engine.computeMetrics(gold, predicted);

		// Still counted in the predicted positives
		assertEquals(1L, result.getCounts().getPredictedPositivesPerDoc().get("doc9"));
		assertEquals(2, result.getCounts().getPredictedPositives());
		assertEquals(0.5, result.getMicroPrecision(), DELTA);

		assertEquals(ImmutableList.of("doc1"), result.getDocumentIds().asList());
		assertFalse(result.getPrecisionPerDocument().containsKey("doc9"));
		assertFalse(result.getRecallPerDocument().containsKey("doc9"));
		assertFalse(result.getF1PerDocument().containsKey("doc9"));
		assertEquals(1.0, result.getPrecisionPerDocument().get("doc1"), DELTA);
	}

	@Test
	public void testPredictedDocumentWithoutMatchesIsUndefined() {
		RecordSet gold = records(span("doc1", "0", "5", "DISEASE"), span("doc2", "0", "5", "DISEASE"));
		RecordSet predicted = records(span("doc1", "6", "9", "DISEASE"), span("doc2", "0", "5", "DISEASE"));

		PositiveCounts counts = engine.countPositives(gold, predicted);
		assertFalse(counts.getTruePositivesPerDoc().containsKey("doc1"));
		assertEquals(1L, counts.getTruePositivesPerDoc().get("doc2"));
		assertEquals(1L, counts.getPredictedPositivesPerDoc().get("doc1"));

		MetricsResult result = engine.calculateMetrics(counts);
		assertTrue(Double.isNaN(result.getPrecisionPerDocument().get("doc1")));
		assertTrue(Double.isNaN(result.getRecallPerDocument().get("doc1")));
		assertTrue(Double.isNaN(result.getF1PerDocument().get("doc1")));
		assertEquals(1.0, result.getF1PerDocument().get("doc2"), DELTA);
		assertEquals(0.5, result.getMicroPrecision(), DELTA);
	}

	@Test
	public void testRowOrderDoesNotMatter() {
		List<AnnotationRecord> goldRecords = new ArrayList<>();
		List<AnnotationRecord> predictedRecords = new ArrayList<>();
		for (int i = 0; i < 50; i++) {
			String document = "doc" + (i % 7);
			goldRecords.add(span(document, String.valueOf(i), String.valueOf(i + 3), i % 2 == 0 ? "DISEASE" : "SYMPTOM"));
			if (i % 3 != 0)
				predictedRecords.add(span(document, String.valueOf(i), String.valueOf(i + 3), i % 4 == 0 ? "DISEASE" : "SYMPTOM"));
		}
		predictedRecords.add(span("doc42", "0", "1", "DISEASE"));

		MetricsResult expected = engine.computeMetrics(normalizer.normalizeRecords(goldRecords), normalizer.normalizeRecords(predictedRecords));

		Random random = new Random(17);
		for (int round = 0; round < 5; round++) {
			Collections.shuffle(goldRecords, random);
			Collections.shuffle(predictedRecords, random);
			MetricsResult shuffled = engine.computeMetrics(normalizer.normalizeRecords(goldRecords), normalizer.normalizeRecords(predictedRecords));

			assertEquals(expected.getMicroPrecision(), shuffled.getMicroPrecision());
			assertEquals(expected.getMicroRecall(), shuffled.getMicroRecall());
			assertEquals(expected.getMicroF1(), shuffled.getMicroF1());
			assertEquals(expected.getPrecisionPerDocument(), shuffled.getPrecisionPerDocument());
			assertEquals(expected.getRecallPerDocument(), shuffled.getRecallPerDocument());
			assertEquals(expected.getF1PerDocument(), shuffled.getF1PerDocument());
		}
	}

	@Test
	public void testInputsAreNotModified() {
		RecordSet gold = records(span("doc1", "0", "5", "DISEASE"), span("doc2", "0", "5", "DISEASE"));
		RecordSet predicted = records(span("doc1", "0", "5", "DISEASE"), span("doc3", "0", "5", "DISEASE"));
		ImmutableList<AnnotationRecord> goldBefore = gold.getRecords();
		ImmutableList<AnnotationRecord> predictedBefore = predicted.getRecords();

		PositiveCounts counts = engine.countPositives(gold, predicted);
		engine.calculateMetrics(counts);

		assertEquals(goldBefore, gold.getRecords());
		assertEquals(predictedBefore, predicted.getRecords());
		assertTrue(counts.getPredictedPositivesPerDoc().containsKey("doc3"));
	}
}
