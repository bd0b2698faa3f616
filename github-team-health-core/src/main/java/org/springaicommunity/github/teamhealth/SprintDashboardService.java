package org.springaicommunity.github.teamhealth;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds per-sprint team figures from stored issues and evaluations.
 */
public class SprintDashboardService {

	private final RepositoryStore repositoryStore;

	private final CollaboratorStore collaboratorStore;

	private final IssueStore issueStore;

	private final EvaluationStore evaluationStore;

	private final Clock clock;

	public SprintDashboardService(RepositoryStore repositoryStore, CollaboratorStore collaboratorStore,
			IssueStore issueStore, EvaluationStore evaluationStore, Clock clock) {
		this.repositoryStore = repositoryStore;
		this.collaboratorStore = collaboratorStore;
		this.issueStore = issueStore;
		this.evaluationStore = evaluationStore;
		this.clock = clock;
	}

	/**
	 * @param repositoryId the repository
	 * @param sprintOffset 0 for the current sprint, -1 for the previous one, and so on
	 * @return the dashboard, or a not-found failure
	 */
	public OperationResult<SprintDashboard> dashboard(long repositoryId, int sprintOffset) {
		Optional<TrackedRepository> found = repositoryStore.findById(repositoryId);
		if (found.isEmpty()) {
			return OperationResult.failure(OperationResult.FailureKind.NOT_FOUND,
					"Repository not found: " + repositoryId);
		}
		TrackedRepository repository = found.get();
		Sprint sprint = repository.sprintCalculator().sprintWithOffset(LocalDateTime.now(clock), sprintOffset);

		List<Issue> issues = issueStore.findByRepositoryIdAndSprintNumber(repositoryId, sprint.number().value());
		Map<Long, Evaluation> evaluations = issues.isEmpty() ? Map.of()
				: evaluationStore.findByIssueIds(issues.stream().map(Issue::id).toList())
					.stream()
					.collect(Collectors.toMap(Evaluation::issueId, Function.identity()));

		Map<Long, List<Issue>> byAuthor = issues.stream()
			.filter(issue -> issue.authorCollaboratorId() != null)
			.collect(Collectors.groupingBy(Issue::authorCollaboratorId));

		List<CollaboratorStats> perCollaborator = new ArrayList<>();
		for (Collaborator collaborator : collaboratorStore.findByRepositoryId(repositoryId)) {
			List<Issue> authored = byAuthor.getOrDefault(collaborator.id(), List.of());
			if (!authored.isEmpty()) {
				perCollaborator.add(new CollaboratorStats(collaborator, IssueStats.of(authored, evaluations)));
			}
		}
		perCollaborator.sort(Comparator.comparing(s -> s.collaborator().githubUserName()));

		return OperationResult
			.success(new SprintDashboard(repository, sprint, IssueStats.of(issues, evaluations), perCollaborator));
	}

}
