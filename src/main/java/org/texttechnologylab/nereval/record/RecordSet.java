package org.texttechnologylab.nereval.record;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Function;

/**
 * An ordered, immutable collection of {@link AnnotationRecord AnnotationRecords} from a single source, either the
 * gold standard or a set of predictions.
 * <p/>
 * Instances are only created by the {@link RecordNormalizer}, which guarantees that no two records share the same
 * {@link MatchKey}.
 */
public final class RecordSet implements Iterable<AnnotationRecord> {
	private static final RecordSet EMPTY = new RecordSet(ImmutableList.of());

	private final ImmutableList<AnnotationRecord> records;

	RecordSet(ImmutableList<AnnotationRecord> records) {
		this.records = records;
	}

	public static RecordSet empty() {
		return EMPTY;
	}

	public ImmutableList<AnnotationRecord> getRecords() {
		return records;
	}

	public int size() {
		return records.size();
	}

	public boolean isEmpty() {
		return records.isEmpty();
	}

	/**
	 * @return The ids of all documents with at least one record, in order of first appearance.
	 */
	public ImmutableSet<String> getDocumentIds() {
		return collect(AnnotationRecord::getDocumentId);
	}

	/**
	 * @return The distinct span positions of this set. Records differing only in their label collapse into one
	 * position.
	 */
	public ImmutableSet<SpanPosition> getPositions() {
		return collect(AnnotationRecord::getPosition);
	}

	public ImmutableSet<MatchKey> getMatchKeys() {
		return collect(AnnotationRecord::getMatchKey);
	}

	private <T> ImmutableSet<T> collect(Function<AnnotationRecord, T> key) {
		ImmutableSet.Builder<T> builder = ImmutableSet.builder();
		for (AnnotationRecord record : records) {
			builder.add(key.apply(record));
		}
		return builder.build();
	}

	@Nonnull
	@Override
	public Iterator<AnnotationRecord> iterator() {
		return records.iterator();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof RecordSet)) return false;
		return records.equals(((RecordSet) o).records);
	}

	@Override
	public int hashCode() {
		return Objects.hash(records);
	}

	@Override
	public String toString() {
		return "RecordSet" + records;
	}
}
