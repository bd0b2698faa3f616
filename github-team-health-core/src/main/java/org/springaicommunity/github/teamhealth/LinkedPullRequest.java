package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

/**
 * A merged pull request that references an issue, with the content needed to judge it.
 *
 * @param number the PR number
 * @param title the PR title
 * @param body the PR description (may be null)
 * @param url the web URL for the PR
 * @param diff unified diff text, possibly truncated, or a per-file change summary
 * @param changedFiles number of changed files
 * @param additions number of added lines
 * @param deletions number of deleted lines
 */
public record LinkedPullRequest(int number, String title, @Nullable String body, String url, String diff,
		int changedFiles, int additions, int deletions) {

	public Reference toReference() {
		return new Reference(number, title, url);
	}

	/**
	 * The identifying part of a linked PR, kept with stored evaluations.
	 *
	 * @param number the PR number
	 * @param title the PR title
	 * @param url the web URL for the PR
	 */
	public record Reference(int number, String title, String url) {
	}

}
