package org.springaicommunity.github.stalerepos;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists repositories, classifies them and writes the reports.
 */
public class StaleRepoScanService {

	private static final Logger logger = LoggerFactory.getLogger(StaleRepoScanService.class);

	private final RestService restService;

	private final Classifier classifier;

	private final List<ReportWriter> reportWriters;

	public StaleRepoScanService(RestService restService, Classifier classifier, List<ReportWriter> reportWriters) {
		this.restService = restService;
		this.classifier = classifier;
		this.reportWriters = List.copyOf(reportWriters);
	}

	public ScanResult scan(ScanRequest request) {
		Policy policy = request.policy();
		logger.info("Starting stale repo search...");
		if (request.organization() == null) {
			logger.info("ORGANIZATION not set, searching all repos owned by the token owner");
		}
		if (!policy.exemptRepoPatterns().isEmpty()) {
			logger.info("Exempt repos: {}", policy.exemptRepoPatterns());
		}
		if (!policy.exemptTopics().isEmpty()) {
			logger.info("Exempt topics: {}", policy.exemptTopics());
		}

		Iterable<RepositorySummary> repositories = GitHubRepositorySummary
			.adapt(restService.listRepositories(request.organization()), restService);
		List<ClassificationResult> stale = new ArrayList<>(
				classifier.classify(repositories, policy, request.organization()));
		stale.sort(ClassificationResult.BY_DAYS_INACTIVE_DESC);

		if (stale.isEmpty() && request.skipEmptyReports()) {
			logger.info("No stale repos found, skipping reports");
			return new ScanResult(stale, List.of());
		}

		ReportContext context = ReportContext.of(policy, request.outputDirectory());
		List<Path> written = new ArrayList<>();
		for (ReportWriter writer : reportWriters) {
			written.add(writer.write(stale, context));
		}
		return new ScanResult(stale, written);
	}

}
