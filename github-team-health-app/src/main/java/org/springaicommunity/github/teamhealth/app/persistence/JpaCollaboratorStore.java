package org.springaicommunity.github.teamhealth.app.persistence;

import org.springaicommunity.github.teamhealth.Collaborator;
import org.springaicommunity.github.teamhealth.CollaboratorStore;
import org.springaicommunity.github.teamhealth.GitHubUser;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
@Transactional
public class JpaCollaboratorStore implements CollaboratorStore {

	private final CollaboratorEntityRepository collaborators;

	private final Clock clock;

	public JpaCollaboratorStore(CollaboratorEntityRepository collaborators, Clock clock) {
		this.collaborators = collaborators;
		this.clock = clock;
	}

	@Override
	@Transactional(readOnly = true)
	public List<Collaborator> findByRepositoryId(long repositoryId) {
		return collaborators.findByRepositoryIdOrderByGithubUserNameAsc(repositoryId)
			.stream()
			.map(CollaboratorEntity::toCollaborator)
			.toList();
	}

	@Override
	public List<Collaborator> saveAll(long repositoryId, List<GitHubUser> users) {
		Set<String> known = new HashSet<>();
		for (CollaboratorEntity existing : collaborators.findByRepositoryIdOrderByGithubUserNameAsc(repositoryId)) {
			known.add(existing.getGithubUserName());
		}

		LocalDateTime now = LocalDateTime.now(clock);
		List<CollaboratorEntity> added = new ArrayList<>();
		for (GitHubUser user : users) {
			if (!known.add(user.login())) {
				continue;
			}
			CollaboratorEntity entity = new CollaboratorEntity();
			entity.setRepositoryId(repositoryId);
			entity.setGithubUserName(user.login());
			entity.setDisplayName(user.displayName());
			entity.setCreatedAt(now);
			added.add(entity);
		}
		return collaborators.saveAll(added).stream().map(CollaboratorEntity::toCollaborator).toList();
	}

}
