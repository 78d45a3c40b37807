package org.springaicommunity.github.stalerepos.cli;

import ch.qos.logback.classic.Level;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.stalerepos.*;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Stale Repos CLI Application
 *
 * Plain Java command-line application that reports repositories without activity for a
 * configurable number of days. Uses StaleReposBuilder for service wiring.
 *
 * Usage: java -jar stale-repos-cli.jar [OPTIONS]
 *
 * Environment Variables: GH_TOKEN - GitHub personal access token, INACTIVE_DAYS -
 * threshold in days, ORGANIZATION - organization to scan
 *
 * Examples: java -jar stale-repos-cli.jar --org spring-projects --inactive-days 365 java
 * -jar stale-repos-cli.jar -d 90 --additional-metrics release,pr
 */
public class StaleReposCli {

	private static final Logger logger = LoggerFactory.getLogger(StaleReposCli.class);

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		return run(args, EnvironmentSupport.lookup());
	}

	static int run(String[] args, Function<String, @Nullable String> environment) {
		ScanProperties properties = new ScanProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties, environment);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		try {
			// Configuration errors surface before any network call
			ParsedConfiguration config = argumentParser.parseAndValidate(args);
			argumentParser.validateEnvironment(config);
			ScanRequest request = ScanRequest.from(config);

			if (config.verbose) {
				enableVerboseLogging();
			}
			logConfiguration(config);

			StaleRepoScanService scanner = StaleReposBuilder.create()
				.token(config.token)
				.appCredentials(config.appId, config.appInstallationId, config.appPrivateKey, config.appEnterpriseOnly)
				.enterpriseUrl(config.enterpriseUrl)
				.properties(properties)
				.workflowSummaryFile(config.workflowSummaryPath())
				.stepOutputFile(config.stepOutputPath())
				.buildScanService();

			ScanResult result = scanner.scan(request);
			logResults(result);
			return 0;
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			logger.error("Configuration error: {}", e.getMessage());
			return 1;
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			logger.error("GitHub API request failed: {}", e.getMessage());
			return 1;
		}
		catch (RuntimeException e) {
			logger.error("Scan failed: {}", e.getMessage(), e);
			return 1;
		}
	}

	private static void enableVerboseLogging() {
		Logger projectLogger = LoggerFactory.getLogger("org.springaicommunity.github.stalerepos");
		if (projectLogger instanceof ch.qos.logback.classic.Logger) {
			((ch.qos.logback.classic.Logger) projectLogger).setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Organization: {}", config.organization != null ? config.organization : "(token owner)");
		logger.info("  Enterprise URL: {}", config.enterpriseUrl != null ? config.enterpriseUrl : "(github.com)");
		logger.info("  Authentication: {}", config.usesAppAuthentication()
				? "GitHub App " + config.appId + " (installation " + config.appInstallationId + ")" : "token");
		logger.info("  Inactive days: {}", config.inactiveDays);
		logger.info("  Activity method: {}", config.activityMethod.value());
		logger.info("  Exempt repos: {}", config.exemptRepos);
		logger.info("  Exempt topics: {}", config.exemptTopics);
		logger.info("  Additional metrics: {}", config.additionalMetrics);
		logger.info("  Output directory: {}", config.outputDirectory);
		logger.info("  Skip empty reports: {}", config.skipEmptyReports);
		logger.info("  Workflow summary: {}", config.workflowSummaryEnabled);
	}

	private static void logResults(ScanResult result) {
		logger.info("Scan completed successfully!");
		logger.info("Stale repos: {}", result.staleRepositories().size());
		for (Path report : result.reportFiles()) {
			logger.info("  - {}", report);
		}
	}

}
