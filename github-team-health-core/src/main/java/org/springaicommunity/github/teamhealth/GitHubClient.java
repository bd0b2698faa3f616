package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

/**
 * Raw HTTP access to the GitHub REST and GraphQL APIs.
 *
 * <p>
 * Implementations return response bodies as strings; JSON parsing happens in
 * {@link GitHubSourceControlClient} and {@link GitHubLinkedPullRequestResolver}.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request against the REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?), may be empty
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String getWithQuery(String path, String queryString);

	/**
	 * Execute a POST request against the GraphQL API.
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String postGraphQL(String body);

	/**
	 * Rate limit observed on the most recent response, or null before the first one.
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
