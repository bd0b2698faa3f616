package org.springaicommunity.github.teamhealth.app.persistence;

import org.springaicommunity.github.teamhealth.PullRequest;
import org.springaicommunity.github.teamhealth.PullRequestStore;
import org.springaicommunity.github.teamhealth.PullRequestUpsert;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@Transactional
public class JpaPullRequestStore implements PullRequestStore {

	private final PullRequestEntityRepository pullRequests;

	private final Clock clock;

	private final int lookupChunkSize;

	@Autowired
	public JpaPullRequestStore(PullRequestEntityRepository pullRequests, Clock clock) {
		this(pullRequests, clock, NumberChunks.DEFAULT_SIZE);
	}

	JpaPullRequestStore(PullRequestEntityRepository pullRequests, Clock clock, int lookupChunkSize) {
		this.pullRequests = pullRequests;
		this.clock = clock;
		this.lookupChunkSize = lookupChunkSize;
	}

	@Override
	public List<PullRequest> upsertAll(List<PullRequestUpsert> upserts) {
		if (upserts.isEmpty()) {
			return List.of();
		}
		LocalDateTime now = LocalDateTime.now(clock);
		Map<Long, List<PullRequestUpsert>> byRepository = upserts.stream()
			.collect(Collectors.groupingBy(PullRequestUpsert::repositoryId, LinkedHashMap::new, Collectors.toList()));

		List<PullRequestEntity> written = new ArrayList<>();
		for (Map.Entry<Long, List<PullRequestUpsert>> entry : byRepository.entrySet()) {
			Map<Integer, PullRequestEntity> existing = new LinkedHashMap<>();
			List<Integer> numbers = entry.getValue().stream().map(PullRequestUpsert::githubNumber).toList();
			for (List<Integer> chunk : NumberChunks.of(numbers, lookupChunkSize)) {
				for (PullRequestEntity entity : pullRequests.findByRepositoryIdAndGithubNumberIn(entry.getKey(),
						chunk)) {
					existing.put(entity.getGithubNumber(), entity);
				}
			}
			for (PullRequestUpsert upsert : entry.getValue()) {
				PullRequestEntity entity = existing.computeIfAbsent(upsert.githubNumber(),
						number -> new PullRequestEntity());
				entity.apply(upsert, now);
			}
			written.addAll(pullRequests.saveAll(existing.values()));
		}
		return written.stream().map(PullRequestEntity::toPullRequest).toList();
	}

	@Override
	@Transactional(readOnly = true)
	public List<PullRequest> findByRepositoryId(long repositoryId) {
		return pullRequests.findByRepositoryIdOrderByGithubNumberAsc(repositoryId)
			.stream()
			.map(PullRequestEntity::toPullRequest)
			.toList();
	}

	@Override
	@Transactional(readOnly = true)
	public List<PullRequest> findUnlinkedByRepositoryId(long repositoryId) {
		return pullRequests.findByRepositoryIdAndIssueIdIsNullOrderByGithubNumberAsc(repositoryId)
			.stream()
			.map(PullRequestEntity::toPullRequest)
			.toList();
	}

	@Override
	@Transactional(readOnly = true)
	public List<PullRequest> findByIssueId(long issueId) {
		return pullRequests.findByIssueIdOrderByGithubNumberAsc(issueId)
			.stream()
			.map(PullRequestEntity::toPullRequest)
			.toList();
	}

	@Override
	public void linkToIssue(long pullRequestId, long issueId) {
		PullRequestEntity entity = pullRequests.findById(pullRequestId)
			.orElseThrow(() -> new IllegalArgumentException("Pull request not found: " + pullRequestId));
		entity.setIssueId(issueId);
		entity.setUpdatedAt(LocalDateTime.now(clock));
		pullRequests.save(entity);
	}

}
