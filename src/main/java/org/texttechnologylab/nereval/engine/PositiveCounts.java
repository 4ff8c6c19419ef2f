package org.texttechnologylab.nereval.engine;

import com.google.common.collect.ImmutableSortedMap;

/**
 * True, predicted and gold positive counts of one evaluation, in total and per document.
 * <p/>
 * {@link #getTruePositivesPerDoc()} holds the documents with at least one match, plus an explicit 0 for every gold
 * document without any prediction. A predicted gold document without a match has no entry, so its per-document
 * metrics are {@link Double#NaN NaN}.
 * {@link #getPredictedPositivesPerDoc()} holds every predicted document, including those absent from the gold
 * standard; these are dropped when per-document precision is derived.
 */
public final class PositiveCounts {
	private final ImmutableSortedMap<String, Long> truePositivesPerDoc;
	private final long truePositives;
	private final ImmutableSortedMap<String, Long> predictedPositivesPerDoc;
	private final long predictedPositives;
	private final ImmutableSortedMap<String, Long> goldPositivesPerDoc;
	private final long goldPositives;

	public PositiveCounts(ImmutableSortedMap<String, Long> truePositivesPerDoc, long truePositives,
	                      ImmutableSortedMap<String, Long> predictedPositivesPerDoc, long predictedPositives,
	                      ImmutableSortedMap<String, Long> goldPositivesPerDoc, long goldPositives) {
		this.truePositivesPerDoc = truePositivesPerDoc;
		this.truePositives = truePositives;
		this.predictedPositivesPerDoc = predictedPositivesPerDoc;
		this.predictedPositives = predictedPositives;
		this.goldPositivesPerDoc = goldPositivesPerDoc;
		this.goldPositives = goldPositives;
	}

	public ImmutableSortedMap<String, Long> getTruePositivesPerDoc() {
		return truePositivesPerDoc;
	}

	public long getTruePositives() {
		return truePositives;
	}

	public ImmutableSortedMap<String, Long> getPredictedPositivesPerDoc() {
		return predictedPositivesPerDoc;
	}

	public long getPredictedPositives() {
		return predictedPositives;
	}

	public ImmutableSortedMap<String, Long> getGoldPositivesPerDoc() {
		return goldPositivesPerDoc;
	}

	public long getGoldPositives() {
		return goldPositives;
	}

	@Override
	public String toString() {
		return String.format("PositiveCounts{tp=%d, predicted=%d, gold=%d}", truePositives, predictedPositives, goldPositives);
	}
}
