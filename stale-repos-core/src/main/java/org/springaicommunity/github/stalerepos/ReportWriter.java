package org.springaicommunity.github.stalerepos;

import java.nio.file.Path;
import java.util.List;

/**
 * Renders classification results to a report file.
 *
 * <p>
 * Implementations present results most inactive first and never modify the given list.
 */
public interface ReportWriter {

	/**
	 * Write the report.
	 * @param results stale repositories in classification order
	 * @param context threshold, columns and output location
	 * @return the report file written
	 * @throws java.io.UncheckedIOException if the report cannot be written
	 */
	Path write(List<ClassificationResult> results, ReportContext context);

}
