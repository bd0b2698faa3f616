package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

/**
 * A GitHub account seen as a contributor, collaborator or issue author.
 *
 * @param login the GitHub username
 * @param id the unique GitHub user ID, or 0 when the source does not provide it
 * @param name the display name (may be null if not set or not returned by the endpoint)
 */
public record GitHubUser(String login, long id, @Nullable String name) {

	/**
	 * Display name, falling back to the login.
	 */
	public String displayName() {
		return name != null && !name.isBlank() ? name : login;
	}

}
