package org.springaicommunity.github.teamhealth.app.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface IssueEntityRepository extends JpaRepository<IssueEntity, Long> {

	Optional<IssueEntity> findByRepositoryIdAndGithubNumber(Long repositoryId, int githubNumber);

	List<IssueEntity> findByRepositoryIdAndGithubNumberIn(Long repositoryId, Collection<Integer> githubNumbers);

	List<IssueEntity> findByRepositoryIdOrderByGithubNumberAsc(Long repositoryId);

	List<IssueEntity> findByRepositoryIdAndSprintNumberOrderByGithubNumberAsc(Long repositoryId, int sprintNumber);

}
