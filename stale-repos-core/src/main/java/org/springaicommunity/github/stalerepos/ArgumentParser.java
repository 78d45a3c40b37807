package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Command-line argument parser for the stale repository scan. Environment variables are
 * read first and command-line options override them.
 */
public class ArgumentParser {

	private final ScanProperties defaultProperties;

	private final Function<String, @Nullable String> environment;

	public ArgumentParser(ScanProperties defaultProperties) {
		this(defaultProperties, EnvironmentSupport.lookup());
	}

	public ArgumentParser(ScanProperties defaultProperties, Function<String, @Nullable String> environment) {
		this.defaultProperties = defaultProperties;
		this.environment = environment;
	}

	/**
	 * Parse environment variables and command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		applyEnvironment(config);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-o", "--org":
					config.organization = getRequiredValue(args, i, "org");
					i++; // Skip next argument since we consumed it
					break;

				case "-d", "--inactive-days":
					config.inactiveDays = parseInactiveDays(getRequiredValue(args, i, "inactive-days"));
					i++;
					break;

				case "--exempt-repos":
					config.exemptRepos = splitList(getRequiredValue(args, i, "exempt-repos"));
					i++;
					break;

				case "--exempt-topics":
					config.exemptTopics = splitList(getRequiredValue(args, i, "exempt-topics"));
					i++;
					break;

				case "-m", "--activity-method":
					config.activityMethod = ActivityMethod.fromValue(getRequiredValue(args, i, "activity-method"));
					i++;
					break;

				case "--additional-metrics":
					config.additionalMetrics = SupplementalMetric.parseList(getRequiredValue(args, i, "additional-metrics"));
					i++;
					break;

				case "--output-dir":
					config.outputDirectory = getRequiredValue(args, i, "output-dir");
					i++;
					break;

				case "--skip-empty-reports":
					config.skipEmptyReports = true;
					break;

				case "--no-skip-empty-reports":
					config.skipEmptyReports = false;
					break;

				case "--workflow-summary":
					config.workflowSummaryEnabled = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					break;
			}
		}

		// Validate configuration
		if (!config.helpRequested) {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: stale-repos [OPTIONS]\n");
		help.append("\n");
		help.append("Find repositories that have not seen activity for a number of days.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                     Show this help message\n");
		help.append("    -o, --org ORG                  Organization to scan (default: repos owned by the token owner)\n");
		help.append("    -d, --inactive-days DAYS       Days without activity before a repo is stale (required)\n");
		help.append("    --exempt-repos LIST            Comma-separated repository names or glob patterns to skip\n");
		help.append("    --exempt-topics LIST           Comma-separated topics; repos tagged with any are skipped\n");
		help.append("    -m, --activity-method METHOD   pushed or default_branch_updated (default: pushed)\n");
		help.append("    --additional-metrics LIST      Comma-separated subset of: release, pr\n");
		help.append("    -v, --verbose                  Enable verbose logging\n");
		help.append("\n");
		help.append("OUTPUT OPTIONS:\n");
		help.append("    --output-dir DIR               Directory for the reports (default: ")
			.append(defaultProperties.getOutputDirectory())
			.append(")\n");
		help.append("    --skip-empty-reports           Do not write reports when nothing is stale (default)\n");
		help.append("    --no-skip-empty-reports        Write reports even when nothing is stale\n");
		help.append("    --workflow-summary             Append the Markdown report to GITHUB_STEP_SUMMARY\n");
		help.append("\n");
		help.append("    Reports: ")
			.append(defaultProperties.getMarkdownFile())
			.append(" and ")
			.append(defaultProperties.getJsonFile())
			.append("\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GH_TOKEN                 GitHub personal access token (GITHUB_TOKEN also accepted)\n");
		help.append("    GH_APP_ID                GitHub App id (with the two below, used instead of GH_TOKEN)\n");
		help.append("    GH_APP_INSTALLATION_ID   GitHub App installation id\n");
		help.append("    GH_APP_PRIVATE_KEY       GitHub App private key (PEM)\n");
		help.append("    GITHUB_APP_ENTERPRISE_ONLY true to authenticate the app against GH_ENTERPRISE_URL\n");
		help.append("    GH_ENTERPRISE_URL        GitHub Enterprise Server base URL\n");
		help.append("    ORGANIZATION             Same as --org\n");
		help.append("    INACTIVE_DAYS            Same as --inactive-days\n");
		help.append("    EXEMPT_REPOS             Same as --exempt-repos\n");
		help.append("    EXEMPT_TOPICS            Same as --exempt-topics\n");
		help.append("    ACTIVITY_METHOD          Same as --activity-method\n");
		help.append("    ADDITIONAL_METRICS       Same as --additional-metrics\n");
		help.append("    SKIP_EMPTY_REPORTS       true or false (default: true)\n");
		help.append("    WORKFLOW_SUMMARY_ENABLED true or false (default: false)\n");
		help.append("    Command-line options take precedence over environment variables and .env files\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    stale-repos --org spring-projects --inactive-days 365\n");
		help.append("    stale-repos -o my-org -d 90 --exempt-repos \"docs,*-archive\" --additional-metrics release,pr\n");
		help.append("    stale-repos -d 180 --activity-method default_branch_updated --no-skip-empty-reports\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate authentication. GitHub App credentials win when all three are present;
	 * otherwise a token is required ({@code GH_TOKEN}, falling back to
	 * {@code GITHUB_TOKEN}). The token lands in the configuration.
	 * @param config configuration to receive the token
	 * @throws IllegalStateException if the app credentials are incomplete or no
	 * credential is available
	 */
	public void validateEnvironment(ParsedConfiguration config) {
		if (config.appId != null && (config.appInstallationId == null || config.appPrivateKey == null)) {
			throw new IllegalStateException("GH_APP_ID set and GH_APP_INSTALLATION_ID or GH_APP_PRIVATE_KEY variable not set");
		}

		String token = environment.apply("GH_TOKEN");
		if (token == null || token.trim().isEmpty()) {
			token = environment.apply("GITHUB_TOKEN");
		}
		if (token != null && !token.trim().isEmpty()) {
			config.token = token.trim();
		}

		if (config.token == null && !config.usesAppAuthentication()) {
			throw new IllegalStateException(
					"GH_TOKEN or the set of [GH_APP_ID, GH_APP_INSTALLATION_ID, GH_APP_PRIVATE_KEY] environment variables are not set");
		}
	}

	private void applyEnvironment(ParsedConfiguration config) {
		config.enterpriseUrl = blankToNull(environment.apply("GH_ENTERPRISE_URL"));
		config.organization = blankToNull(environment.apply("ORGANIZATION"));

		config.appId = parseOptionalId(environment.apply("GH_APP_ID"));
		config.appInstallationId = parseOptionalId(environment.apply("GH_APP_INSTALLATION_ID"));
		config.appPrivateKey = blankToNull(environment.apply("GH_APP_PRIVATE_KEY"));
		config.appEnterpriseOnly = EnvironmentSupport.parseBoolean(environment.apply("GITHUB_APP_ENTERPRISE_ONLY"),
				false);

		String inactiveDays = blankToNull(environment.apply("INACTIVE_DAYS"));
		if (inactiveDays != null) {
			config.inactiveDays = parseInactiveDays(inactiveDays);
		}

		String exemptRepos = environment.apply("EXEMPT_REPOS");
		if (exemptRepos != null) {
			config.exemptRepos = splitList(exemptRepos);
		}
		String exemptTopics = environment.apply("EXEMPT_TOPICS");
		if (exemptTopics != null) {
			config.exemptTopics = splitList(exemptTopics);
		}

		String activityMethod = blankToNull(environment.apply("ACTIVITY_METHOD"));
		if (activityMethod != null) {
			config.activityMethod = ActivityMethod.fromValue(activityMethod);
		}

		String additionalMetrics = environment.apply("ADDITIONAL_METRICS");
		if (additionalMetrics != null) {
			config.additionalMetrics = SupplementalMetric.parseList(additionalMetrics);
		}

		config.skipEmptyReports = EnvironmentSupport.parseBoolean(environment.apply("SKIP_EMPTY_REPORTS"),
				config.skipEmptyReports);
		config.workflowSummaryEnabled = EnvironmentSupport
			.parseBoolean(environment.apply("WORKFLOW_SUMMARY_ENABLED"), config.workflowSummaryEnabled);
		config.workflowSummaryFile = blankToNull(environment.apply("GITHUB_STEP_SUMMARY"));
		config.stepOutputFile = blankToNull(environment.apply("GITHUB_OUTPUT"));
	}

	private static int parseInactiveDays(String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid inactive days '" + value + "': must be a non-negative integer");
		}
	}

	// Unparseable ids count as unset
	@Nullable
	static Long parseOptionalId(@Nullable String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			return Long.parseLong(value.trim());
		}
		catch (NumberFormatException e) {
			return null;
		}
	}

	static List<String> splitList(String value) {
		return Arrays.stream(value.split(","))
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
	}

	@Nullable
	private static String blankToNull(@Nullable String value) {
		return value == null || value.isBlank() ? null : value.trim();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.inactiveDays == null) {
			errors.add("INACTIVE_DAYS environment variable not set (or pass --inactive-days)");
		}
		else if (config.inactiveDays < 0) {
			errors.add("Inactive days must not be negative (got: " + config.inactiveDays + ")");
		}

		if (config.outputDirectory == null || config.outputDirectory.trim().isEmpty()) {
			errors.add("Output directory cannot be empty");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
