package org.texttechnologylab.nereval.io;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.texttechnologylab.nereval.record.AnnotationColumns;
import org.texttechnologylab.nereval.record.MalformedAnnotationException;

import javax.annotation.Nonnull;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads tab-separated annotation files with a header row into raw rows.
 * <p/>
 * Files are read as UTF-8, a leading byte order mark is skipped. Quoting is disabled, so every field is taken
 * literally. Empty fields stay empty strings. The column order is irrelevant and columns besides the {@link
 * AnnotationColumns#REQUIRED required ones} are carried along unchanged.
 */
public class AnnotationTsvReader {
	private static final Logger logger = LoggerFactory.getLogger(AnnotationTsvReader.class);

	protected CSVFormat csvFormat = CSVFormat.DEFAULT
			.withDelimiter('\t')
			.withQuote(null)
			.withFirstRecordAsHeader()
			.withIgnoreEmptyLines(true)
			.withAllowMissingColumnNames(true);

	@Nonnull
	public List<Map<String, String>> read(@Nonnull Path path) throws MalformedAnnotationException {
		Preconditions.checkNotNull(path, "path");
		// A leading UTF-8 byte order mark would otherwise end up in the first column name
		try (Reader reader = new BufferedReader(new InputStreamReader(
				new BOMInputStream(Files.newInputStream(path)), StandardCharsets.UTF_8))) {
			return read(reader, path.toString());
		} catch (IOException e) {
			logger.error("Error parsing TSV file {}: {}", path, e.toString());
			throw new MalformedAnnotationException("Could not read annotation file " + path, e);
		}
	}

	/**
	 * @param reader     The tab-separated input, header row first. It is not closed.
	 * @param sourceName A name for the input used in log and error messages.
	 */
	@Nonnull
	public List<Map<String, String>> read(@Nonnull Reader reader, @Nonnull String sourceName) throws MalformedAnnotationException {
		try {
			CSVParser parser = csvFormat.parse(reader);
			Map<String, Integer> headerMap = parser.getHeaderMap();
			if (headerMap == null || headerMap.isEmpty())
				throw new MalformedAnnotationException(String.format("Annotation file %s has no header row.", sourceName));

			List<String> missing = AnnotationColumns.REQUIRED.stream()
					.filter(column -> !headerMap.containsKey(column))
					.collect(Collectors.toList());
			if (!missing.isEmpty())
				throw new MalformedAnnotationException(String.format("Annotation file %s lacks required columns %s, found %s.",
						sourceName, missing, headerMap.keySet()));

			ImmutableList.Builder<Map<String, String>> rows = ImmutableList.builder();
			for (CSVRecord record : parser) {
				if (!record.isConsistent())
					throw new MalformedAnnotationException(String.format("Line %d of %s has %d fields, but the header has %d.",
							parser.getCurrentLineNumber(), sourceName, record.size(), headerMap.size()));
				rows.add(record.toMap());
			}
			List<Map<String, String>> result = rows.build();
			logger.debug("Read {} annotation rows from {}.", result.size(), sourceName);
			return result;
		} catch (MalformedAnnotationException e) {
			logger.error("Error parsing TSV file {}: {}", sourceName, e.getMessage());
			throw e;
		} catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
			logger.error("Error parsing TSV file {}: {}", sourceName, e.toString());
			throw new MalformedAnnotationException("Could not parse annotation file " + sourceName, e);
		}
	}
}
