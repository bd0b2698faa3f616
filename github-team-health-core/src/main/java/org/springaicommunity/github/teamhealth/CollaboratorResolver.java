package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Exact-login lookup of a repository's registered collaborators. Unknown logins resolve
 * to null.
 */
final class CollaboratorResolver {

	private final Map<String, Long> idsByLogin = new HashMap<>();

	CollaboratorResolver(List<Collaborator> collaborators) {
		for (Collaborator collaborator : collaborators) {
			idsByLogin.put(collaborator.githubUserName(), collaborator.id());
		}
	}

	@Nullable
	Long resolve(@Nullable String login) {
		return login == null ? null : idsByLogin.get(login);
	}

}
