package org.texttechnologylab.nereval.record;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One labeled span occurrence. Offsets are kept as the strings they were read as, so "05" and "5" denote different
 * spans.
 */
public final class AnnotationRecord {
	/**
	 * Separator between start and end offset in the {@link #getSpanKey() span key}.
	 */
	public static final String SPAN_KEY_DELIMITER = " ";

	private final String documentId;
	private final String spanStart;
	private final String spanEnd;
	private final String spanKey;
	private final String label;
	private final String entityText;

	public AnnotationRecord(@Nonnull String documentId, @Nonnull String spanStart, @Nonnull String spanEnd,
	                        @Nonnull String label, @Nonnull String entityText) {
		this.documentId = Objects.requireNonNull(documentId);
		this.spanStart = Objects.requireNonNull(spanStart);
		this.spanEnd = Objects.requireNonNull(spanEnd);
		this.label = Objects.requireNonNull(label);
		this.entityText = Objects.requireNonNull(entityText);
		this.spanKey = spanStart + SPAN_KEY_DELIMITER + spanEnd;
	}

	public String getDocumentId() {
		return documentId;
	}

	public String getSpanStart() {
		return spanStart;
	}

	public String getSpanEnd() {
		return spanEnd;
	}

	public String getSpanKey() {
		return spanKey;
	}

	public String getLabel() {
		return label;
	}

	public String getEntityText() {
		return entityText;
	}

	public SpanPosition getPosition() {
		return new SpanPosition(documentId, spanKey);
	}

	public MatchKey getMatchKey() {
		return new MatchKey(documentId, spanKey, label);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof AnnotationRecord)) return false;
		AnnotationRecord that = (AnnotationRecord) o;
		return documentId.equals(that.documentId)
				&& spanStart.equals(that.spanStart)
				&& spanEnd.equals(that.spanEnd)
				&& label.equals(that.label)
				&& entityText.equals(that.entityText);
	}

	@Override
	public int hashCode() {
		return Objects.hash(documentId, spanStart, spanEnd, label, entityText);
	}

	@Override
	public String toString() {
		return String.format("%s\t%s\t%s\t%s\t%s", documentId, label, spanStart, spanEnd, entityText);
	}
}
