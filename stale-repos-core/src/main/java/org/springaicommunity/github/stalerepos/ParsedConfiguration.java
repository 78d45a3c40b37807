package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration resolved from environment variables and command-line arguments.
 */
public class ParsedConfiguration {

	// Authentication
	@Nullable
	public String token;

	@Nullable
	public String enterpriseUrl;

	// GitHub App authentication, preferred over the token when complete
	@Nullable
	public Long appId;

	@Nullable
	public Long appInstallationId;

	@Nullable
	public String appPrivateKey;

	public boolean appEnterpriseOnly = false;

	// Scope: null = repositories owned by the token owner
	@Nullable
	public String organization;

	// Policy
	@Nullable
	public Integer inactiveDays;

	public List<String> exemptRepos = new ArrayList<>();

	public List<String> exemptTopics = new ArrayList<>();

	public ActivityMethod activityMethod = ActivityMethod.PUSHED;

	public Set<SupplementalMetric> additionalMetrics = EnumSet.noneOf(SupplementalMetric.class);

	// Output
	public String outputDirectory;

	public boolean skipEmptyReports;

	public boolean workflowSummaryEnabled;

	@Nullable
	public String workflowSummaryFile; // GITHUB_STEP_SUMMARY

	@Nullable
	public String stepOutputFile; // GITHUB_OUTPUT

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(ScanProperties defaultProperties) {
		this.outputDirectory = defaultProperties.getOutputDirectory();
		this.skipEmptyReports = defaultProperties.isSkipEmptyReports();
		this.workflowSummaryEnabled = defaultProperties.isWorkflowSummaryEnabled();
	}

	/**
	 * Build the immutable classification policy.
	 * @return policy
	 * @throws IllegalStateException if the inactive days threshold is not set
	 */
	public Policy toPolicy() {
		if (inactiveDays == null) {
			throw new IllegalStateException("INACTIVE_DAYS environment variable not set");
		}
		return new Policy(inactiveDays, exemptRepos, new LinkedHashSet<>(exemptTopics), activityMethod,
				additionalMetrics);
	}

	/**
	 * Whether the complete set of GitHub App credentials is present.
	 */
	public boolean usesAppAuthentication() {
		return appId != null && appInstallationId != null && appPrivateKey != null;
	}

	public Path outputPath() {
		return Paths.get(outputDirectory);
	}

	/**
	 * Workflow summary target, only when the summary is enabled and the file is known.
	 */
	@Nullable
	public Path workflowSummaryPath() {
		if (!workflowSummaryEnabled || workflowSummaryFile == null || workflowSummaryFile.isBlank()) {
			return null;
		}
		return Paths.get(workflowSummaryFile);
	}

	@Nullable
	public Path stepOutputPath() {
		if (stepOutputFile == null || stepOutputFile.isBlank()) {
			return null;
		}
		return Paths.get(stepOutputFile);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "token=" + (token != null ? "****" : "null") + ", enterpriseUrl='"
				+ enterpriseUrl + '\'' + ", appId=" + appId + ", appInstallationId=" + appInstallationId
				+ ", appPrivateKey=" + (appPrivateKey != null ? "****" : "null") + ", appEnterpriseOnly="
				+ appEnterpriseOnly + ", organization='" + organization + '\'' + ", inactiveDays=" + inactiveDays
				+ ", exemptRepos=" + exemptRepos + ", exemptTopics=" + exemptTopics + ", activityMethod="
				+ activityMethod.value() + ", additionalMetrics=" + additionalMetrics + ", outputDirectory='"
				+ outputDirectory + '\'' + ", skipEmptyReports=" + skipEmptyReports + ", workflowSummaryEnabled="
				+ workflowSummaryEnabled + ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
