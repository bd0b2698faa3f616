package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * Team health of one sprint.
 *
 * @param repository the repository
 * @param sprint the sprint shown
 * @param overall figures over every issue created in the sprint
 * @param collaborators figures per issue author, for registered authors only
 */
public record SprintDashboard(TrackedRepository repository, Sprint sprint, IssueStats overall,
		List<CollaboratorStats> collaborators) {

	public SprintDashboard {
		collaborators = List.copyOf(collaborators);
	}

}
