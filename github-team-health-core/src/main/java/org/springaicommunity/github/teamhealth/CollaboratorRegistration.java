package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * Result of collaborator registration.
 *
 * @param collaborators every collaborator of the repository, existing and new
 * @param addedCount how many were inserted by this run
 * @param source name of the member source that answered
 */
public record CollaboratorRegistration(List<Collaborator> collaborators, int addedCount, String source) {

	public CollaboratorRegistration {
		collaborators = List.copyOf(collaborators);
	}

}
