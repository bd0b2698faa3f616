package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link GitHubClient} on top of the JDK {@link HttpClient}.
 *
 * <p>
 * Every request carries a timeout. Rate limit headers are read from all responses and
 * exposed through {@link #getLastRateLimitInfo()}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String DEFAULT_API_BASE = "https://api.github.com";

	private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final String token;

	private final String apiBase;

	private final Duration requestTimeout;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(token, DEFAULT_API_BASE, DEFAULT_REQUEST_TIMEOUT);
	}

	/**
	 * @param token personal access token
	 * @param apiBase REST base URL, e.g. a GitHub Enterprise API root
	 * @param requestTimeout timeout applied to each request
	 */
	public GitHubHttpClient(String token, String apiBase, Duration requestTimeout) {
		this.token = token;
		this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : apiBase + path;
		HttpRequest request = requestBuilder(url).header("Accept", "application/vnd.github+json").GET().build();
		return send(request, "GET " + url);
	}

	@Override
	public String getWithQuery(String path, String queryString) {
		return get(queryString.isEmpty() ? path : path + "?" + queryString);
	}

	@Override
	public String postGraphQL(String body) {
		HttpRequest request = requestBuilder(apiBase + "/graphql").header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
		return send(request, "POST GraphQL");
	}

	private HttpRequest.Builder requestBuilder(String url) {
		return HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + token)
			.header("X-GitHub-Api-Version", "2022-11-28")
			.header("User-Agent", "github-team-health");
	}

	private String send(HttpRequest request, String description) {
		logger.debug("{}", description);
		long start = System.currentTimeMillis();
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			String body = handleResponse(request, response);
			logger.debug("{} completed in {}ms ({} bytes)", description, System.currentTimeMillis() - start,
					body.length());
			return body;
		}
		catch (HttpTimeoutException e) {
			throw new GitHubApiException(description + " timed out after " + requestTimeout.toMillis() + "ms", e);
		}
		catch (IOException e) {
			logger.error("{} failed: {}", description, e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private String handleResponse(HttpRequest request, HttpResponse<String> response) {
		int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
		long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
		if (remaining >= 0) {
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset);
			if (remaining < 100) {
				logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
			}
		}

		int status = response.statusCode();
		if (status >= 200 && status < 300) {
			return response.body();
		}
		String message = switch (status) {
			case 401 -> "Unauthorized: Bad credentials. Check your GITHUB_TOKEN.";
			case 403 -> remaining == 0 ? "Rate limit exceeded. Resets at epoch: " + reset
					: "Forbidden: " + request.uri();
			case 404 -> "Not found: " + request.uri();
			case 429 -> "Too Many Requests (429). Resets at epoch: " + reset;
			default -> "GitHub API error: " + status;
		};
		throw new GitHubApiException(message, status, response.body(), remaining, reset);
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return (int) parseLongHeader(response, headerName, defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when a GitHub API call fails.
	 *
	 * <p>
	 * Carries the status code and rate limit headers so that {@link RetryingGitHubClient}
	 * and the sync use cases can tell transient failures from permanent ones.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		private final boolean timeout;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
			this.timeout = false;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
			this.timeout = cause instanceof HttpTimeoutException;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		public boolean isTimeout() {
			return timeout;
		}

		/**
		 * Returns true for 429 and for 403 with no remaining requests.
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

		/**
		 * Returns true for 401, 403 and 404 responses that are not rate limit errors: the
		 * token cannot see the resource and retrying will not help.
		 */
		public boolean isAccessDenied() {
			return (statusCode == 401 || statusCode == 403 || statusCode == 404) && !isRateLimitError();
		}

	}

}
