package org.texttechnologylab.nereval.engine;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.texttechnologylab.nereval.record.AnnotationRecord;
import org.texttechnologylab.nereval.record.MatchKey;
import org.texttechnologylab.nereval.record.RecordSet;
import org.texttechnologylab.nereval.record.SpanPosition;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Scores a predicted {@link RecordSet} against a gold standard {@link RecordSet}.
 * <p/>
 * A predicted span is a true positive if a gold span with the same document id, span key and label exists.
 * Predicted and gold positives are counted as distinct (document, span key) positions, ignoring labels.
 * <p/>
 * Per-document metrics are computed for the gold documents only and are not guarded against zero denominators:
 * 0/0 yields {@link Double#NaN NaN}. The micro-averaged metrics fall back to 0 instead.
 */
public class MetricsEngine {
	private static final Logger logger = LoggerFactory.getLogger(MetricsEngine.class);

	@Nonnull
	public MetricsResult computeMetrics(@Nonnull RecordSet gold, @Nonnull RecordSet predicted) {
		return calculateMetrics(countPositives(gold, predicted));
	}

	@Nonnull
	public PositiveCounts countPositives(@Nonnull RecordSet gold, @Nonnull RecordSet predicted) {
		Preconditions.checkNotNull(gold, "gold");
		Preconditions.checkNotNull(predicted, "predicted");

		// Predicted and gold positives: distinct positions, label ignored
		ImmutableSet<SpanPosition> predictedPositions = predicted.getPositions();
		Multiset<String> predictedPositivesPerDoc = countPerDocument(predictedPositions);
		ImmutableSet<SpanPosition> goldPositions = gold.getPositions();
		Multiset<String> goldPositivesPerDoc = countPerDocument(goldPositions);

		// True positives: every gold record looked up in the predicted match keys
		ImmutableSet<MatchKey> predictedKeys = predicted.getMatchKeys();
		Multiset<String> truePositivesPerDoc = HashMultiset.create();
		for (AnnotationRecord goldRecord : gold) {
			if (predictedKeys.contains(goldRecord.getMatchKey()))
				truePositivesPerDoc.add(goldRecord.getDocumentId());
		}

		// Gold documents without any prediction still count, with zero true positives. Predicted gold documents
		// without a match get no entry.
		ImmutableSet<String> goldDocuments = gold.getDocumentIds();
		ImmutableSet<String> predictedDocuments = predicted.getDocumentIds();
		Set<String> notPredicted = Sets.difference(goldDocuments, predictedDocuments);
		if (!notPredicted.isEmpty())
			logger.info("{} gold documents have no predictions: {}", notPredicted.size(), new TreeSet<>(notPredicted));

		Set<String> notInGold = Sets.difference(predictedDocuments, goldDocuments);
		if (!notInGold.isEmpty())
			logger.info("{} predicted documents are not part of the gold standard and are left out of per-document precision: {}",
					notInGold.size(), new TreeSet<>(notInGold));

		return new PositiveCounts(
				sortedCounts(truePositivesPerDoc, notPredicted), truePositivesPerDoc.size(),
				sortedCounts(predictedPositivesPerDoc, ImmutableSet.of()), predictedPositions.size(),
				sortedCounts(goldPositivesPerDoc, ImmutableSet.of()), goldPositions.size()
		);
	}

	@Nonnull
	public MetricsResult calculateMetrics(@Nonnull PositiveCounts counts) {
		Preconditions.checkNotNull(counts, "counts");

		ImmutableSortedMap.Builder<String, Double> precisionPerDocument = ImmutableSortedMap.naturalOrder();
		ImmutableSortedMap.Builder<String, Double> recallPerDocument = ImmutableSortedMap.naturalOrder();
		ImmutableSortedMap.Builder<String, Double> f1PerDocument = ImmutableSortedMap.naturalOrder();

		// Indexed by the gold documents, which excludes predicted documents that are not part of the gold standard
		TreeSet<String> undefined = new TreeSet<>();
		for (Map.Entry<String, Long> entry : counts.getGoldPositivesPerDoc().entrySet()) {
			String documentId = entry.getKey();
			Long matched = counts.getTruePositivesPerDoc().get(documentId);
			double truePositives = matched != null ? matched : Double.NaN;
			double predictedPositives = counts.getPredictedPositivesPerDoc().getOrDefault(documentId, 0L);
			double goldPositives = entry.getValue();

			double precision = truePositives / predictedPositives;
			double recall = truePositives / goldPositives;
			double f1 = (2 * precision * recall) / (precision + recall);

			precisionPerDocument.put(documentId, precision);
			recallPerDocument.put(documentId, recall);
			f1PerDocument.put(documentId, f1);
			if (Double.isNaN(f1))
				undefined.add(documentId);
		}
		if (!undefined.isEmpty())
			logger.debug("Per-document metrics are undefined (0/0) for {} documents: {}", undefined.size(), undefined);

		double precision = counts.getPredictedPositives() > 0
				? (double) counts.getTruePositives() / counts.getPredictedPositives()
				: 0.0;
		double recall = counts.getGoldPositives() > 0
				? (double) counts.getTruePositives() / counts.getGoldPositives()
				: 0.0;
		double f1 = (precision + recall) > 0
				? (2 * precision * recall) / (precision + recall)
				: 0.0;

		return new MetricsResult(
				precisionPerDocument.build(), precision,
				recallPerDocument.build(), recall,
				f1PerDocument.build(), f1,
				counts
		);
	}

	private static Multiset<String> countPerDocument(Set<SpanPosition> positions) {
		Multiset<String> perDocument = HashMultiset.create();
		for (SpanPosition position : positions) {
			perDocument.add(position.getDocumentId());
		}
		return perDocument;
	}

	/**
	 * @param zeroDocuments Documents to hold an explicit 0 unless they were counted.
	 */
	private static ImmutableSortedMap<String, Long> sortedCounts(Multiset<String> counts, Set<String> zeroDocuments) {
		TreeMap<String, Long> sorted = new TreeMap<>();
		for (Multiset.Entry<String> entry : counts.entrySet()) {
			sorted.put(entry.getElement(), (long) entry.getCount());
		}
		for (String documentId : zeroDocuments) {
			sorted.putIfAbsent(documentId, 0L);
		}
		return ImmutableSortedMap.copyOf(sorted);
	}
}
