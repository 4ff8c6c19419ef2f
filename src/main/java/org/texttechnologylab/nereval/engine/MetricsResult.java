package org.texttechnologylab.nereval.engine;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Precision, recall and F1 of an evaluation, per gold document and micro-averaged.
 * <p/>
 * Per-document values may be {@link Double#NaN NaN} where they evaluate to 0/0, e.g. the precision of a gold document
 * without any predictions. Micro-averaged values are always defined.
 */
public final class MetricsResult {
	private final ImmutableSortedMap<String, Double> precisionPerDocument;
	private final double microPrecision;
	private final ImmutableSortedMap<String, Double> recallPerDocument;
	private final double microRecall;
	private final ImmutableSortedMap<String, Double> f1PerDocument;
	private final double microF1;
	private final PositiveCounts counts;

	public MetricsResult(ImmutableSortedMap<String, Double> precisionPerDocument, double microPrecision,
	                     ImmutableSortedMap<String, Double> recallPerDocument, double microRecall,
	                     ImmutableSortedMap<String, Double> f1PerDocument, double microF1,
	                     PositiveCounts counts) {
		this.precisionPerDocument = precisionPerDocument;
		this.microPrecision = microPrecision;
		this.recallPerDocument = recallPerDocument;
		this.microRecall = microRecall;
		this.f1PerDocument = f1PerDocument;
		this.microF1 = microF1;
		this.counts = counts;
	}

	public ImmutableSortedMap<String, Double> getPrecisionPerDocument() {
		return precisionPerDocument;
	}

	public double getMicroPrecision() {
		return microPrecision;
	}

	public ImmutableSortedMap<String, Double> getRecallPerDocument() {
		return recallPerDocument;
	}

	public double getMicroRecall() {
		return microRecall;
	}

	public ImmutableSortedMap<String, Double> getF1PerDocument() {
		return f1PerDocument;
	}

	public double getMicroF1() {
		return microF1;
	}

	public PositiveCounts getCounts() {
		return counts;
	}

	/**
	 * @return The documents the per-document series are indexed by, in sorted order.
	 */
	public ImmutableSortedSet<String> getDocumentIds() {
		return precisionPerDocument.keySet();
	}

	@Override
	public String toString() {
		return String.format("MetricsResult{precision=%s, recall=%s, f1=%s, documents=%d}",
				microPrecision, microRecall, microF1, precisionPerDocument.size());
	}
}
