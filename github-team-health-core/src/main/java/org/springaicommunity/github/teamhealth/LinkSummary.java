package org.springaicommunity.github.teamhealth;

/**
 * Result of linking pull requests to the issues they close.
 *
 * @param linked pull requests linked to a local issue
 * @param unlinked pull requests without a closing reference to a stored issue
 * @param failed pull requests whose lookup failed
 */
public record LinkSummary(int linked, int unlinked, int failed) {

	public static LinkSummary empty() {
		return new LinkSummary(0, 0, 0);
	}

}
