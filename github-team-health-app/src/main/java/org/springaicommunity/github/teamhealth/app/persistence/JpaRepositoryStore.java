package org.springaicommunity.github.teamhealth.app.persistence;

import org.springaicommunity.github.teamhealth.RepositoryRegistration;
import org.springaicommunity.github.teamhealth.RepositoryStore;
import org.springaicommunity.github.teamhealth.TrackedRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
@Transactional
public class JpaRepositoryStore implements RepositoryStore {

	private final RepositoryEntityRepository repositories;

	private final Clock clock;

	public JpaRepositoryStore(RepositoryEntityRepository repositories, Clock clock) {
		this.repositories = repositories;
		this.clock = clock;
	}

	@Override
	@Transactional(readOnly = true)
	public Optional<TrackedRepository> findById(long id) {
		return repositories.findById(id).map(RepositoryEntity::toRepository);
	}

	@Override
	@Transactional(readOnly = true)
	public Optional<TrackedRepository> findByOwnerAndName(String ownerName, String repoName) {
		return repositories.findByOwnerNameAndRepoName(ownerName, repoName).map(RepositoryEntity::toRepository);
	}

	@Override
	@Transactional(readOnly = true)
	public List<TrackedRepository> findAll() {
		return repositories.findAllByOrderByIdAsc().stream().map(RepositoryEntity::toRepository).toList();
	}

	@Override
	public TrackedRepository save(RepositoryRegistration registration) {
		if (registration.trackingStartDate() == null || registration.sprintStartDayOfWeek() == null
				|| registration.sprintDurationWeeks() == null) {
			throw new IllegalArgumentException("Sprint settings of " + registration.ownerName() + "/"
					+ registration.repoName() + " must be resolved before saving");
		}
		if (repositories.findByOwnerNameAndRepoName(registration.ownerName(), registration.repoName()).isPresent()) {
			throw new IllegalStateException(
					"Repository already registered: " + registration.ownerName() + "/" + registration.repoName());
		}

		RepositoryEntity entity = new RepositoryEntity();
		entity.setOwnerName(registration.ownerName());
		entity.setRepoName(registration.repoName());
		entity.setEncryptedToken(registration.encryptedToken());
		entity.setTrackingStartDate(registration.trackingStartDate());
		entity.setSprintStartDayOfWeek(registration.sprintStartDayOfWeek());
		entity.setSprintDurationWeeks(registration.sprintDurationWeeks());
		entity.setCreatedAt(LocalDateTime.now(clock));
		try {
			return repositories.saveAndFlush(entity).toRepository();
		}
		catch (DataIntegrityViolationException e) {
			throw new IllegalStateException(
					"Repository already registered: " + registration.ownerName() + "/" + registration.repoName(), e);
		}
	}

}
