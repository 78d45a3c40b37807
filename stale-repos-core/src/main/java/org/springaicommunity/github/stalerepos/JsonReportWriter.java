package org.springaicommunity.github.stalerepos;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes the JSON report ({@code stale_repos.json}).
 *
 * <p>
 * When a step output file is configured (the file named by {@code GITHUB_OUTPUT} in
 * GitHub Actions), the same JSON is appended to it as {@code inactiveRepos=<json>} so
 * later workflow steps can consume it.
 */
public class JsonReportWriter implements ReportWriter {

	private static final Logger logger = LoggerFactory.getLogger(JsonReportWriter.class);

	static final String OUTPUT_NAME = "inactiveRepos";

	private final ObjectMapper objectMapper;

	private final String fileName;

	@Nullable
	private final Path stepOutputFile;

	public JsonReportWriter(ObjectMapper objectMapper) {
		this(objectMapper, ScanProperties.DEFAULT_JSON_FILE, null);
	}

	public JsonReportWriter(ObjectMapper objectMapper, String fileName, @Nullable Path stepOutputFile) {
		this.objectMapper = objectMapper;
		this.fileName = fileName;
		this.stepOutputFile = stepOutputFile;
	}

	@Override
	public Path write(List<ClassificationResult> results, ReportContext context) {
		String json = toJson(results);
		Path target = context.outputDirectory().resolve(fileName);
		try {
			Files.createDirectories(context.outputDirectory());
			Files.writeString(target, json, StandardCharsets.UTF_8);
			logger.info("Wrote stale repos to {}", target);
			// Step output only once the report file exists
			if (stepOutputFile != null) {
				Files.writeString(stepOutputFile, OUTPUT_NAME + "=" + json + System.lineSeparator(),
						StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write JSON report to " + target, e);
		}
		return target;
	}

	/**
	 * Serialize results, most inactive first, as a single-line JSON array.
	 * @param results stale repositories
	 * @return JSON text
	 */
	public String toJson(List<ClassificationResult> results) {
		List<ClassificationResult> sorted = results.stream().sorted(ClassificationResult.BY_DAYS_INACTIVE_DESC).toList();
		try {
			return objectMapper.writeValueAsString(sorted);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize stale repos", e);
		}
	}

}
