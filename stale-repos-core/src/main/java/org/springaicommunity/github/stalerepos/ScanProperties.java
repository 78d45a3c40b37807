package org.springaicommunity.github.stalerepos;

/**
 * Defaults for a stale repository scan that do not come from the environment.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link StaleReposBuilder} and
 * {@link ArgumentParser}.
 */
public class ScanProperties {

	public static final String DEFAULT_MARKDOWN_FILE = "stale_repos.md";

	public static final String DEFAULT_JSON_FILE = "stale_repos.json";

	/**
	 * File name of the Markdown report.
	 */
	private String markdownFile = DEFAULT_MARKDOWN_FILE;

	/**
	 * File name of the JSON report.
	 */
	private String jsonFile = DEFAULT_JSON_FILE;

	/**
	 * Directory the reports are written to.
	 */
	private String outputDirectory = ".";

	/**
	 * Repositories requested per page when listing (GitHub caps this at 100).
	 */
	private int pageSize = 100;

	/**
	 * Skip writing reports when no stale repositories were found.
	 */
	private boolean skipEmptyReports = true;

	/**
	 * Append the Markdown report to the GitHub Actions workflow summary.
	 */
	private boolean workflowSummaryEnabled = false;

	public String getMarkdownFile() {
		return markdownFile;
	}

	public void setMarkdownFile(String markdownFile) {
		this.markdownFile = markdownFile;
	}

	public String getJsonFile() {
		return jsonFile;
	}

	public void setJsonFile(String jsonFile) {
		this.jsonFile = jsonFile;
	}

	public String getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(String outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	public boolean isSkipEmptyReports() {
		return skipEmptyReports;
	}

	public void setSkipEmptyReports(boolean skipEmptyReports) {
		this.skipEmptyReports = skipEmptyReports;
	}

	public boolean isWorkflowSummaryEnabled() {
		return workflowSummaryEnabled;
	}

	public void setWorkflowSummaryEnabled(boolean workflowSummaryEnabled) {
		this.workflowSummaryEnabled = workflowSummaryEnabled;
	}

}
