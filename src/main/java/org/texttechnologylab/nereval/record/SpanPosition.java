package org.texttechnologylab.nereval.record;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A span position inside a document, ignoring its label. Predicted and gold positives are counted as distinct
 * positions.
 */
public final class SpanPosition {
	private final String documentId;
	private final String spanKey;

	public SpanPosition(@Nonnull String documentId, @Nonnull String spanKey) {
		this.documentId = Objects.requireNonNull(documentId);
		this.spanKey = Objects.requireNonNull(spanKey);
	}

	public String getDocumentId() {
		return documentId;
	}

	public String getSpanKey() {
		return spanKey;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SpanPosition)) return false;
		SpanPosition that = (SpanPosition) o;
		return documentId.equals(that.documentId) && spanKey.equals(that.spanKey);
	}

	@Override
	public int hashCode() {
		return Objects.hash(documentId, spanKey);
	}

	@Override
	public String toString() {
		return documentId + "[" + spanKey + "]";
	}
}
