package org.springaicommunity.github.teamhealth;

/**
 * Result of an issue or pull request sync.
 *
 * @param syncedCount number of items written
 * @param currentSprintNumber the repository's sprint at the time of the sync
 */
public record SyncSummary(int syncedCount, int currentSprintNumber) {
}
