package org.springaicommunity.github.stalerepos;

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
 * Writes the Markdown table report ({@code stale_repos.md}).
 *
 * <p>
 * When a workflow summary file is configured (the file named by
 * {@code GITHUB_STEP_SUMMARY} in GitHub Actions), the same content is appended to it.
 */
public class MarkdownReportWriter implements ReportWriter {

	private static final Logger logger = LoggerFactory.getLogger(MarkdownReportWriter.class);

	static final String ABSENT_MARKER = "None";

	private final String fileName;

	@Nullable
	private final Path workflowSummaryFile;

	public MarkdownReportWriter() {
		this(ScanProperties.DEFAULT_MARKDOWN_FILE, null);
	}

	public MarkdownReportWriter(String fileName, @Nullable Path workflowSummaryFile) {
		this.fileName = fileName;
		this.workflowSummaryFile = workflowSummaryFile;
	}

	@Override
	public Path write(List<ClassificationResult> results, ReportContext context) {
		String content = render(results, context);
		Path target = context.outputDirectory().resolve(fileName);
		try {
			Files.createDirectories(context.outputDirectory());
			Files.writeString(target, content, StandardCharsets.UTF_8);
			logger.info("Wrote stale repos to {}", target);

			if (workflowSummaryFile != null) {
				Files.writeString(workflowSummaryFile, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
						StandardOpenOption.APPEND);
				logger.info("Added stale repos to workflow summary");
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write Markdown report to " + target, e);
		}
		return target;
	}

	/**
	 * Render the report text.
	 * @param results stale repositories
	 * @param context threshold and metric columns
	 * @return Markdown document
	 */
	public String render(List<ClassificationResult> results, ReportContext context) {
		boolean releaseColumn = context.additionalMetrics().contains(SupplementalMetric.RELEASE);
		boolean prColumn = context.additionalMetrics().contains(SupplementalMetric.PR);

		StringBuilder content = new StringBuilder();
		content.append("# Inactive Repositories\n\n");
		content.append("The following repos ")
			.append(context.activityMethod().reportPhrase())
			.append(" for more than ")
			.append(context.inactiveDays())
			.append(" days:\n\n");

		content.append("| Repository URL | Days Inactive | Last Push Date | Visibility |");
		if (releaseColumn) {
			content.append(" Days Since Last Release |");
		}
		if (prColumn) {
			content.append(" Days Since Last PR |");
		}
		content.append("\n| --- | --- | --- | --- |");
		if (releaseColumn) {
			content.append(" --- |");
		}
		if (prColumn) {
			content.append(" --- |");
		}
		content.append("\n");

		for (ClassificationResult result : results.stream().sorted(ClassificationResult.BY_DAYS_INACTIVE_DESC).toList()) {
			content.append("| ")
				.append(result.url())
				.append(" | ")
				.append(result.daysInactive())
				.append(" | ")
				.append(result.lastActiveDate())
				.append(" | ")
				.append(result.visibility())
				.append(" |");
			if (releaseColumn) {
				content.append(" ").append(cell(result.daysSinceLastRelease())).append(" |");
			}
			if (prColumn) {
				content.append(" ").append(cell(result.daysSinceLastPr())).append(" |");
			}
			content.append("\n");
		}
		return content.toString();
	}

	private static String cell(SignalLookup<Integer> metric) {
		return metric.asOptional().map(String::valueOf).orElse(ABSENT_MARKER);
	}

}
