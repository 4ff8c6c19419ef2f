package org.texttechnologylab.nereval.record;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * The (document, span, label) triple on which a predicted span has to agree with a gold span to count as a true
 * positive. Also the uniqueness key of a {@link RecordSet}.
 */
public final class MatchKey {
	private final String documentId;
	private final String spanKey;
	private final String label;

	public MatchKey(@Nonnull String documentId, @Nonnull String spanKey, @Nonnull String label) {
		this.documentId = Objects.requireNonNull(documentId);
		this.spanKey = Objects.requireNonNull(spanKey);
		this.label = Objects.requireNonNull(label);
	}

	public String getDocumentId() {
		return documentId;
	}

	public String getSpanKey() {
		return spanKey;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof MatchKey)) return false;
		MatchKey matchKey = (MatchKey) o;
		return documentId.equals(matchKey.documentId)
				&& spanKey.equals(matchKey.spanKey)
				&& label.equals(matchKey.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(documentId, spanKey, label);
	}

	@Override
	public String toString() {
		return documentId + "[" + spanKey + "]:" + label;
	}
}
