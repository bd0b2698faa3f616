package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * Input for registering a repository.
 *
 * @param ownerName the repository owner
 * @param repoName the repository name
 * @param encryptedToken optional encrypted access token
 * @param trackingStartDate sprint base date, today when null
 * @param sprintStartDayOfWeek sprint start weekday, the configured default when null
 * @param sprintDurationWeeks sprint length, the configured default when null
 */
public record RepositoryRegistration(String ownerName, String repoName, @Nullable String encryptedToken,
		@Nullable LocalDate trackingStartDate, @Nullable Integer sprintStartDayOfWeek,
		@Nullable Integer sprintDurationWeeks) {

	public static RepositoryRegistration of(String ownerName, String repoName) {
		return new RepositoryRegistration(ownerName, repoName, null, null, null, null);
	}

}
