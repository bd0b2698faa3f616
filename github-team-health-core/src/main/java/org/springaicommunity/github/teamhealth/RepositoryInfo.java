package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

/**
 * Basic repository information from the GitHub API.
 *
 * @param id the unique repository ID
 * @param owner the owner login
 * @param name the repository name (without owner)
 * @param fullName the full repository name in "owner/repo" format
 * @param description the repository description (may be null)
 * @param htmlUrl the web URL for the repository
 * @param isPrivate whether the repository is private
 * @param defaultBranch the default branch name
 */
public record RepositoryInfo(long id, String owner, String name, String fullName, @Nullable String description,
		String htmlUrl, boolean isPrivate, String defaultBranch) {

}
