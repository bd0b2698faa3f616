package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * One way of listing a repository's team members. {@link CollaboratorRegistrationService}
 * tries its sources in order and uses the first that is available.
 */
public interface MemberSource {

	/**
	 * Short name used in logs and results, e.g. "contributors".
	 */
	String name();

	/**
	 * @param owner repository owner
	 * @param repo repository name
	 * @return the members, or {@link MemberLookup.Unavailable} when this source cannot
	 * answer for the repository
	 * @throws RuntimeException on failures other than missing access, which end the
	 * lookup
	 */
	MemberLookup lookup(String owner, String repo);

	/**
	 * Result of a {@link MemberSource} lookup.
	 */
	sealed interface MemberLookup permits MemberLookup.Available, MemberLookup.Unavailable {

		/**
		 * @param members the members found, never empty
		 */
		record Available(List<GitHubUser> members) implements MemberLookup {
		}

		/**
		 * @param reason why the source could not answer
		 */
		record Unavailable(String reason) implements MemberLookup {
		}

	}

}
