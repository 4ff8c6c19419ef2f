package org.texttechnologylab.nereval.record;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Restricts raw annotation rows to a set of entity labels. The given labels are upper-cased, the labels of the rows
 * are compared as they are.
 * <p/>
 * A filter created from an empty or <b>null</b> collection accepts every row.
 */
public class EntityFilter {
	private static final Logger logger = LoggerFactory.getLogger(EntityFilter.class);

	private static final EntityFilter ACCEPT_ALL = new EntityFilter(ImmutableSet.of());

	private final ImmutableSet<String> labels;

	private EntityFilter(ImmutableSet<String> labels) {
		this.labels = labels;
	}

	@Nonnull
	public static EntityFilter of(@Nullable Collection<String> labels) {
		if (labels == null || labels.isEmpty())
			return ACCEPT_ALL;
		ImmutableSet<String> upperCased = labels.stream()
				.filter(Objects::nonNull)
				.map(StringUtils::upperCase)
				.collect(ImmutableSet.toImmutableSet());
		return upperCased.isEmpty() ? ACCEPT_ALL : new EntityFilter(upperCased);
	}

	@Nonnull
	public static EntityFilter acceptAll() {
		return ACCEPT_ALL;
	}

	public boolean isActive() {
		return !labels.isEmpty();
	}

	public ImmutableSet<String> getLabels() {
		return labels;
	}

	public boolean accepts(@Nullable String label) {
		return !isActive() || labels.contains(label);
	}

	@Nonnull
	public List<Map<String, String>> apply(@Nonnull List<Map<String, String>> rawRows) {
		if (!isActive())
			return rawRows;
		// Null rows are passed on so the normalizer can report them.
		List<Map<String, String>> kept = rawRows.stream()
				.filter(row -> row == null || accepts(row.get(AnnotationColumns.LABEL)))
				.collect(Collectors.toList());
		logger.debug("Entity filter {} kept {} of {} rows.", labels, kept.size(), rawRows.size());
		return kept;
	}
}
