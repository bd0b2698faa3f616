package org.springaicommunity.github.teamhealth.app.persistence;

import org.springaicommunity.github.teamhealth.Issue;
import org.springaicommunity.github.teamhealth.IssueStore;
import org.springaicommunity.github.teamhealth.IssueUpsert;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Issue store backed by JPA. An upsert looks up the existing rows of the batch first and
 * updates them in place, so (repositoryId, githubNumber) never gets a second row.
 */
@Component
@Transactional
public class JpaIssueStore implements IssueStore {

	private final IssueEntityRepository issues;

	private final Clock clock;

	private final int lookupChunkSize;

	@Autowired
	public JpaIssueStore(IssueEntityRepository issues, Clock clock) {
		this(issues, clock, NumberChunks.DEFAULT_SIZE);
	}

	JpaIssueStore(IssueEntityRepository issues, Clock clock, int lookupChunkSize) {
		this.issues = issues;
		this.clock = clock;
		this.lookupChunkSize = lookupChunkSize;
	}

	@Override
	public List<Issue> upsertAll(List<IssueUpsert> upserts) {
		if (upserts.isEmpty()) {
			return List.of();
		}
		LocalDateTime now = LocalDateTime.now(clock);
		Map<Long, List<IssueUpsert>> byRepository = upserts.stream()
			.collect(Collectors.groupingBy(IssueUpsert::repositoryId, LinkedHashMap::new, Collectors.toList()));

		List<IssueEntity> written = new ArrayList<>();
		for (Map.Entry<Long, List<IssueUpsert>> entry : byRepository.entrySet()) {
			Map<Integer, IssueEntity> existing = new LinkedHashMap<>();
			List<Integer> numbers = entry.getValue().stream().map(IssueUpsert::githubNumber).toList();
			for (List<Integer> chunk : NumberChunks.of(numbers, lookupChunkSize)) {
				for (IssueEntity entity : issues.findByRepositoryIdAndGithubNumberIn(entry.getKey(), chunk)) {
					existing.put(entity.getGithubNumber(), entity);
				}
			}
			for (IssueUpsert upsert : entry.getValue()) {
				IssueEntity entity = existing.computeIfAbsent(upsert.githubNumber(), number -> new IssueEntity());
				entity.apply(upsert, now);
			}
			written.addAll(issues.saveAll(existing.values()));
		}
		return written.stream().map(IssueEntity::toIssue).toList();
	}

	@Override
	@Transactional(readOnly = true)
	public Optional<Issue> findById(long id) {
		return issues.findById(id).map(IssueEntity::toIssue);
	}

	@Override
	@Transactional(readOnly = true)
	public Optional<Issue> findByRepositoryIdAndNumber(long repositoryId, int githubNumber) {
		return issues.findByRepositoryIdAndGithubNumber(repositoryId, githubNumber).map(IssueEntity::toIssue);
	}

	@Override
	@Transactional(readOnly = true)
	public List<Issue> findByRepositoryId(long repositoryId) {
		return issues.findByRepositoryIdOrderByGithubNumberAsc(repositoryId).stream().map(IssueEntity::toIssue).toList();
	}

	@Override
	@Transactional(readOnly = true)
	public List<Issue> findByRepositoryIdAndSprintNumber(long repositoryId, int sprintNumber) {
		return issues.findByRepositoryIdAndSprintNumberOrderByGithubNumberAsc(repositoryId, sprintNumber)
			.stream()
			.map(IssueEntity::toIssue)
			.toList();
	}

}
