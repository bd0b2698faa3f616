package org.springaicommunity.github.teamhealth.app.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface PullRequestEntityRepository extends JpaRepository<PullRequestEntity, Long> {

	List<PullRequestEntity> findByRepositoryIdAndGithubNumberIn(Long repositoryId, Collection<Integer> githubNumbers);

	List<PullRequestEntity> findByRepositoryIdOrderByGithubNumberAsc(Long repositoryId);

	List<PullRequestEntity> findByRepositoryIdAndIssueIdIsNullOrderByGithubNumberAsc(Long repositoryId);

	List<PullRequestEntity> findByIssueIdOrderByGithubNumberAsc(Long issueId);

}
