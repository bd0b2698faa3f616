package org.springaicommunity.github.teamhealth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Registers a GitHub repository for tracking.
 */
public class RepositoryRegistrationService {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryRegistrationService.class);

	private final RepositoryStore repositoryStore;

	private final TeamHealthProperties properties;

	private final Clock clock;

	public RepositoryRegistrationService(RepositoryStore repositoryStore, TeamHealthProperties properties,
			Clock clock) {
		this.repositoryStore = repositoryStore;
		this.properties = properties;
		this.clock = clock;
	}

	/**
	 * Validate and store a repository. Missing sprint settings take the configured
	 * defaults and a missing tracking start date becomes today.
	 * @param registration the repository to register
	 * @return the stored repository, or a failure
	 */
	public OperationResult<TrackedRepository> register(RepositoryRegistration registration) {
		String owner = registration.ownerName().trim();
		String repo = registration.repoName().trim();
		if (owner.isEmpty() || repo.isEmpty()) {
			return OperationResult.failure(OperationResult.FailureKind.INVALID_INPUT,
					"Owner and repository name are required");
		}

		int weeks = registration.sprintDurationWeeks() != null ? registration.sprintDurationWeeks()
				: properties.getDefaultSprintDurationWeeks();
		if (weeks != 1 && weeks != 2) {
			return OperationResult.failure(OperationResult.FailureKind.INVALID_INPUT,
					"Sprint duration must be 1 or 2 weeks, got " + weeks);
		}
		int startDay = registration.sprintStartDayOfWeek() != null ? registration.sprintStartDayOfWeek()
				: properties.getDefaultSprintStartDayOfWeek();
		if (startDay < 0 || startDay > 6) {
			return OperationResult.failure(OperationResult.FailureKind.INVALID_INPUT,
					"Sprint start day must be between 0 (Sunday) and 6 (Saturday), got " + startDay);
		}

		if (repositoryStore.findByOwnerAndName(owner, repo).isPresent()) {
			return OperationResult.failure(OperationResult.FailureKind.ALREADY_EXISTS,
					"Repository already registered: " + owner + "/" + repo);
		}

		LocalDate trackingStart = registration.trackingStartDate() != null ? registration.trackingStartDate()
				: LocalDate.now(clock);
		try {
			TrackedRepository saved = repositoryStore.save(new RepositoryRegistration(owner, repo,
					registration.encryptedToken(), trackingStart, startDay, weeks));
			logger.info("Registered repository {} (sprints of {} week(s) starting on day {} from {})",
					saved.fullName(), weeks, startDay, trackingStart);
			return OperationResult.success(saved);
		}
		catch (IllegalStateException e) {
			return OperationResult.failure(OperationResult.FailureKind.ALREADY_EXISTS, e.getMessage());
		}
		catch (RuntimeException e) {
			logger.error("Storing repository {}/{} failed", owner, repo, e);
			return OperationResult.failure(OperationResult.FailureKind.PERSISTENCE_FAILURE,
					"Failed to store repository: " + e.getMessage());
		}
	}

}
