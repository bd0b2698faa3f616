package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

/**
 * A team member registered for a repository. Unique by (repositoryId, githubUserName).
 *
 * @param id the local id
 * @param repositoryId the owning repository
 * @param githubUserName the GitHub login
 * @param displayName the display name, if known
 */
public record Collaborator(long id, long repositoryId, String githubUserName, @Nullable String displayName) {
}
