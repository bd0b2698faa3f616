package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Decorator that retries failed {@link GitHubClient} calls.
 *
 * <p>
 * Transport errors, timeouts and 5xx responses are retried with exponential backoff.
 * Rate limit errors (429, or 403 with no remaining requests) wait until the reported
 * reset time when it is less than an hour away. Other 4xx responses fail immediately.
 * After a successful call the client slows down once the remaining rate limit drops
 * below the pacing threshold.
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private static final long MAX_PACING_MS = 10_000;

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private final int pacingThreshold;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.pacingThreshold = builder.pacingThreshold;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return execute(() -> delegate.get(path), "GET " + path);
	}

	@Override
	public String getWithQuery(String path, String queryString) {
		return execute(() -> delegate.getWithQuery(path, queryString), "GET " + path + "?" + queryString);
	}

	@Override
	public String postGraphQL(String body) {
		return execute(() -> delegate.postGraphQL(body), "POST GraphQL");
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private String execute(Supplier<String> call, String description) {
		long backoff = initialDelayMs;
		int attempts = maxRetries + 1;
		for (int attempt = 1;; attempt++) {
			try {
				String result = call.get();
				paceIfNeeded(description);
				return result;
			}
			catch (RuntimeException e) {
				if (!isRetryable(e) || attempt >= attempts) {
					if (attempt > 1) {
						logger.error("{} failed after {} attempts", description, attempt);
					}
					throw e;
				}
				long waitMs = waitBeforeRetry(e, backoff);
				logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt, attempts,
						e.getMessage(), waitMs);
				sleep(waitMs);
				backoff *= 2;
			}
		}
	}

	static boolean isRetryable(RuntimeException e) {
		if (e instanceof GitHubHttpClient.GitHubApiException apiException) {
			int status = apiException.getStatusCode();
			return apiException.isRateLimitError() || status < 400 || status >= 500;
		}
		return true;
	}

	private long waitBeforeRetry(RuntimeException e, long backoff) {
		if (e instanceof GitHubHttpClient.GitHubApiException apiException && apiException.isRateLimitError()
				&& apiException.getResetEpochSeconds() > 0) {
			long waitSeconds = apiException.getResetEpochSeconds() - Instant.now().getEpochSecond() + 1;
			if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset", waitSeconds);
				return waitSeconds * 1000;
			}
		}
		return backoff;
	}

	private void paceIfNeeded(String description) {
		RateLimitInfo info = delegate.getLastRateLimitInfo();
		if (info == null || !info.isBelow(pacingThreshold)) {
			return;
		}
		long paceMs = info.pacingDelayMillis(Instant.now(), MAX_PACING_MS);
		if (paceMs > 0) {
			logger.debug("Pacing: {}/{} remaining, sleeping {}ms ({})", info.remaining(), info.limit(), paceMs,
					description);
			sleep(paceMs);
		}
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingGitHubClient}. Defaults: 3 retries, 1 second initial
	 * delay, pacing below 100 remaining requests.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private int pacingThreshold = 100;

		private Builder() {
		}

		/**
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		public Builder pacingThreshold(int threshold) {
			this.pacingThreshold = threshold;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
