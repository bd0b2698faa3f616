package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A GitHub repository registered for tracking. Identity is (ownerName, repoName).
 *
 * @param id the local id
 * @param ownerName the repository owner
 * @param repoName the repository name
 * @param encryptedToken optional encrypted access token for this repository
 * @param trackingStartDate base date of sprint number 1
 * @param sprintStartDayOfWeek 0 (Sunday) to 6 (Saturday)
 * @param sprintDurationWeeks 1 or 2
 * @param createdAt when the repository was registered
 */
public record TrackedRepository(long id, String ownerName, String repoName, @Nullable String encryptedToken,
		LocalDate trackingStartDate, int sprintStartDayOfWeek, int sprintDurationWeeks, LocalDateTime createdAt) {

	public String fullName() {
		return ownerName + "/" + repoName;
	}

	public SprintSettings sprintSettings() {
		return new SprintSettings(sprintStartDayOfWeek, sprintDurationWeeks, trackingStartDate);
	}

	public SprintCalculator sprintCalculator() {
		return new SprintCalculator(sprintSettings());
	}

}
