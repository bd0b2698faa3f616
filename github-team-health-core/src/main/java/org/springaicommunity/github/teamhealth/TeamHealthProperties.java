package org.springaicommunity.github.teamhealth;

import java.time.Duration;

/**
 * Tunables for sync and evaluation.
 *
 * <p>
 * Defaults suit a single small team. Batch concurrency and delay exist to stay inside the
 * AI provider's rate limits; raise them together with the provider quota.
 */
public class TeamHealthProperties {

	/**
	 * Page size for paginated GitHub REST calls (GitHub allows at most 100).
	 */
	private int pageSize = 100;

	/**
	 * Maximum number of retry attempts for failed GitHub requests.
	 */
	private int maxRetries = 3;

	/**
	 * Timeout of a single GitHub request.
	 */
	private Duration githubRequestTimeout = Duration.ofSeconds(30);

	/**
	 * Issues evaluated by one batch run when the caller gives no limit.
	 */
	private int batchLimit = 10;

	/**
	 * Upper bound on the limit a caller may request for one batch run.
	 */
	private int maxBatchLimit = 20;

	/**
	 * Evaluations running at the same time within a batch.
	 */
	private int batchConcurrency = 2;

	/**
	 * Pause between consecutive groups of batch evaluations.
	 */
	private Duration batchDelay = Duration.ofSeconds(1);

	/**
	 * Time allowed for one evaluation, including the AI call.
	 */
	private Duration evaluationTimeout = Duration.ofSeconds(60);

	/**
	 * Sampling temperature sent with rubric prompts.
	 */
	private double temperature = 0.3;

	/**
	 * Token limit for AI replies.
	 */
	private int maxTokens = 2000;

	/**
	 * Characters of pull request diff included in consistency prompts.
	 */
	private int diffCharacterLimit = 5000;

	/**
	 * Sprint start weekday for repositories registered without one, 0 (Sunday) to 6.
	 */
	private int defaultSprintStartDayOfWeek = SprintSettings.DEFAULT_START_DAY_OF_WEEK;

	/**
	 * Sprint length in weeks for repositories registered without one.
	 */
	private int defaultSprintDurationWeeks = SprintSettings.DEFAULT_DURATION_WEEKS;

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public Duration getGithubRequestTimeout() {
		return githubRequestTimeout;
	}

	public void setGithubRequestTimeout(Duration githubRequestTimeout) {
		this.githubRequestTimeout = githubRequestTimeout;
	}

	public int getBatchLimit() {
		return batchLimit;
	}

	public void setBatchLimit(int batchLimit) {
		this.batchLimit = batchLimit;
	}

	public int getMaxBatchLimit() {
		return maxBatchLimit;
	}

	public void setMaxBatchLimit(int maxBatchLimit) {
		this.maxBatchLimit = maxBatchLimit;
	}

	public int getBatchConcurrency() {
		return batchConcurrency;
	}

	public void setBatchConcurrency(int batchConcurrency) {
		this.batchConcurrency = batchConcurrency;
	}

	public Duration getBatchDelay() {
		return batchDelay;
	}

	public void setBatchDelay(Duration batchDelay) {
		this.batchDelay = batchDelay;
	}

	public Duration getEvaluationTimeout() {
		return evaluationTimeout;
	}

	public void setEvaluationTimeout(Duration evaluationTimeout) {
		this.evaluationTimeout = evaluationTimeout;
	}

	public double getTemperature() {
		return temperature;
	}

	public void setTemperature(double temperature) {
		this.temperature = temperature;
	}

	public int getMaxTokens() {
		return maxTokens;
	}

	public void setMaxTokens(int maxTokens) {
		this.maxTokens = maxTokens;
	}

	public int getDiffCharacterLimit() {
		return diffCharacterLimit;
	}

	public void setDiffCharacterLimit(int diffCharacterLimit) {
		this.diffCharacterLimit = diffCharacterLimit;
	}

	public int getDefaultSprintStartDayOfWeek() {
		return defaultSprintStartDayOfWeek;
	}

	public void setDefaultSprintStartDayOfWeek(int defaultSprintStartDayOfWeek) {
		this.defaultSprintStartDayOfWeek = defaultSprintStartDayOfWeek;
	}

	public int getDefaultSprintDurationWeeks() {
		return defaultSprintDurationWeeks;
	}

	public void setDefaultSprintDurationWeeks(int defaultSprintDurationWeeks) {
		this.defaultSprintDurationWeeks = defaultSprintDurationWeeks;
	}

}
