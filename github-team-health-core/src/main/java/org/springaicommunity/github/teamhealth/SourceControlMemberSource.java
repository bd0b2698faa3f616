package org.springaicommunity.github.teamhealth;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link MemberSource} implementations over a {@link SourceControlClient}. Missing access
 * (401, 403, 404) and empty answers are reported as unavailable.
 */
public abstract class SourceControlMemberSource implements MemberSource {

	protected final SourceControlClient sourceControlClient;

	protected SourceControlMemberSource(SourceControlClient sourceControlClient) {
		this.sourceControlClient = sourceControlClient;
	}

	/**
	 * The default fallback order: contributors, collaborators, issue authors.
	 */
	public static List<MemberSource> defaultChain(SourceControlClient sourceControlClient) {
		return List.of(new Contributors(sourceControlClient), new Collaborators(sourceControlClient),
				new IssueAuthors(sourceControlClient));
	}

	@Override
	public final MemberLookup lookup(String owner, String repo) {
		List<GitHubUser> members;
		try {
			members = fetch(owner, repo);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isAccessDenied()) {
				return new MemberLookup.Unavailable(name() + " not accessible (HTTP " + e.getStatusCode() + ")");
			}
			throw e;
		}
		if (members.isEmpty()) {
			return new MemberLookup.Unavailable("no " + name() + " found");
		}
		return new MemberLookup.Available(members);
	}

	protected abstract List<GitHubUser> fetch(String owner, String repo);

	/**
	 * Accounts with commits on the default branch.
	 */
	public static class Contributors extends SourceControlMemberSource {

		public Contributors(SourceControlClient sourceControlClient) {
			super(sourceControlClient);
		}

		@Override
		public String name() {
			return "contributors";
		}

		@Override
		protected List<GitHubUser> fetch(String owner, String repo) {
			return sourceControlClient.getContributors(owner, repo);
		}

	}

	/**
	 * Accounts with explicit repository access. Needs push access for the token.
	 */
	public static class Collaborators extends SourceControlMemberSource {

		public Collaborators(SourceControlClient sourceControlClient) {
			super(sourceControlClient);
		}

		@Override
		public String name() {
			return "collaborators";
		}

		@Override
		protected List<GitHubUser> fetch(String owner, String repo) {
			return sourceControlClient.getCollaborators(owner, repo);
		}

	}

	/**
	 * Distinct authors of the repository's issues, in order of first appearance.
	 */
	public static class IssueAuthors extends SourceControlMemberSource {

		public IssueAuthors(SourceControlClient sourceControlClient) {
			super(sourceControlClient);
		}

		@Override
		public String name() {
			return "issue authors";
		}

		@Override
		protected List<GitHubUser> fetch(String owner, String repo) {
			Map<String, GitHubUser> authors = new LinkedHashMap<>();
			for (GitHubIssue issue : sourceControlClient.getIssues(owner, repo, null)) {
				String login = issue.authorLogin();
				if (login != null && !login.isBlank()) {
					authors.putIfAbsent(login, new GitHubUser(login, 0, null));
				}
			}
			return new ArrayList<>(authors.values());
		}

	}

}
