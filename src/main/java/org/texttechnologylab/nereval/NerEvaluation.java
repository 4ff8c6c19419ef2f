package org.texttechnologylab.nereval;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.texttechnologylab.nereval.engine.MetricsEngine;
import org.texttechnologylab.nereval.engine.MetricsResult;
import org.texttechnologylab.nereval.io.AnnotationTsvReader;
import org.texttechnologylab.nereval.record.EntityFilter;
import org.texttechnologylab.nereval.record.MalformedAnnotationException;
import org.texttechnologylab.nereval.record.RecordNormalizer;
import org.texttechnologylab.nereval.record.RecordSet;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * Evaluates a prediction file against a gold standard file: both are read, restricted by the {@link EntityFilter},
 * normalized and passed to the {@link MetricsEngine}.
 */
public class NerEvaluation {
	private static final Logger logger = LoggerFactory.getLogger(NerEvaluation.class);

	private final AnnotationTsvReader reader;
	private final RecordNormalizer normalizer;
	private final MetricsEngine engine;
	private final EntityFilter entityFilter;

	public NerEvaluation() {
		this(EntityFilter.acceptAll());
	}

	public NerEvaluation(@Nonnull EntityFilter entityFilter) {
		this(new AnnotationTsvReader(), new RecordNormalizer(), new MetricsEngine(), entityFilter);
	}

	public NerEvaluation(@Nonnull AnnotationTsvReader reader, @Nonnull RecordNormalizer normalizer,
	                     @Nonnull MetricsEngine engine, @Nonnull EntityFilter entityFilter) {
		this.reader = Preconditions.checkNotNull(reader);
		this.normalizer = Preconditions.checkNotNull(normalizer);
		this.engine = Preconditions.checkNotNull(engine);
		this.entityFilter = Preconditions.checkNotNull(entityFilter);
	}

	@Nonnull
	public MetricsResult evaluate(@Nonnull Path goldStandard, @Nonnull Path predictions) throws MalformedAnnotationException {
		if (entityFilter.isActive())
			logger.info("Restricting evaluation to entities {}", entityFilter.getLabels());

		RecordSet gold = load(goldStandard);
		RecordSet predicted = load(predictions);
		logger.info("Loaded {} gold and {} predicted annotations.", gold.size(), predicted.size());

		MetricsResult result = engine.computeMetrics(gold, predicted);
		logger.debug("{}", result.getCounts());
		return result;
	}

	@Nonnull
	public RecordSet load(@Nonnull Path path) throws MalformedAnnotationException {
		return normalizer.normalize(entityFilter.apply(reader.read(path)));
	}
}
