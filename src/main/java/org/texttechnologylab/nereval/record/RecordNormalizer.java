package org.texttechnologylab.nereval.record;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Turns raw annotation rows into a {@link RecordSet}: derives the span key of each row and removes rows that repeat
 * an earlier row's {@link MatchKey}. The first occurrence of each duplicate group is kept, the input order is
 * preserved otherwise.
 */
public class RecordNormalizer {
	private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);

	/**
	 * @param rawRows Rows mapping column names to values, as produced by {@link
	 *                org.texttechnologylab.nereval.io.AnnotationTsvReader AnnotationTsvReader}.
	 * @return The normalized and deduplicated record set.
	 * @throws MalformedAnnotationException If a row lacks one of the {@link AnnotationColumns#REQUIRED required
	 *                                      columns}.
	 */
	@Nonnull
	public RecordSet normalize(@Nonnull List<Map<String, String>> rawRows) throws MalformedAnnotationException {
		Preconditions.checkNotNull(rawRows, "rawRows");
		ImmutableList.Builder<AnnotationRecord> records = ImmutableList.builderWithExpectedSize(rawRows.size());
		for (int i = 0; i < rawRows.size(); i++) {
			Map<String, String> row = rawRows.get(i);
			records.add(new AnnotationRecord(
					field(row, i, AnnotationColumns.DOCUMENT_ID),
					field(row, i, AnnotationColumns.START_SPAN),
					field(row, i, AnnotationColumns.END_SPAN),
					field(row, i, AnnotationColumns.LABEL),
					field(row, i, AnnotationColumns.ENTITY_TEXT)
			));
		}
		return deduplicate(records.build());
	}

	/**
	 * Re-applies the deduplication to an existing set. Normalizing a set that is already normalized returns an equal
	 * set.
	 */
	@Nonnull
	public RecordSet normalize(@Nonnull RecordSet recordSet) {
		Preconditions.checkNotNull(recordSet, "recordSet");
		return deduplicate(recordSet.getRecords());
	}

	/**
	 * Builds a record set from already constructed records, deduplicating them.
	 */
	@Nonnull
	public RecordSet normalizeRecords(@Nonnull Iterable<AnnotationRecord> records) {
		Preconditions.checkNotNull(records, "records");
		return deduplicate(ImmutableList.copyOf(records));
	}

	private RecordSet deduplicate(ImmutableList<AnnotationRecord> records) {
		HashSet<MatchKey> seen = new HashSet<>();
		ImmutableList.Builder<AnnotationRecord> unique = ImmutableList.builderWithExpectedSize(records.size());
		for (AnnotationRecord record : records) {
			if (seen.add(record.getMatchKey()))
				unique.add(record);
		}

		int removed = records.size() - seen.size();
		if (removed > 0) {
			logger.warn("Duplicated entries found and removed: {} of {} rows share (filename, label, offset) with an earlier row.",
					removed, records.size());
			return new RecordSet(unique.build());
		}
		return new RecordSet(records);
	}

	private static String field(Map<String, String> row, int index, String column) throws MalformedAnnotationException {
		if (row == null)
			throw new MalformedAnnotationException(String.format("Row %d is missing.", index));
		String value = row.get(column);
		if (value == null)
			throw new MalformedAnnotationException(String.format("Row %d has no value for required column '%s'.", index, column));
		return value;
	}
}
