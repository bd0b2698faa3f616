package org.springaicommunity.github.teamhealth;

import java.time.Instant;

/**
 * Snapshot of the {@code X-RateLimit-*} headers of the last GitHub response.
 *
 * @param limit requests allowed in the current window, -1 when not reported
 * @param remaining requests left in the current window
 * @param reset epoch second at which the window resets, -1 when not reported
 */
public record RateLimitInfo(int limit, int remaining, long reset) {

	/**
	 * Whether calls should slow down: some requests are left, but fewer than the
	 * threshold.
	 */
	public boolean isBelow(int threshold) {
		return remaining > 0 && remaining < threshold;
	}

	/**
	 * Delay that spreads the remaining requests evenly until the reset, bounded to
	 * {@code [100, maxMillis]}. Zero when the reset is unknown or already passed.
	 */
	public long pacingDelayMillis(Instant now, long maxMillis) {
		long secondsUntilReset = reset - now.getEpochSecond();
		if (reset < 0 || secondsUntilReset <= 0 || remaining <= 0) {
			return 0;
		}
		return Math.max(100, Math.min(maxMillis, secondsUntilReset * 1000 / remaining));
	}

}
