package org.springaicommunity.github.teamhealth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("GitHubLinkedPullRequestResolver Tests")
@ExtendWith(MockitoExtension.class)
class GitHubLinkedPullRequestResolverTest {

	@Mock
	private GitHubClient gitHubClient;

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private GitHubLinkedPullRequestResolver resolver;

	@BeforeEach
	void setUp() {
		resolver = new GitHubLinkedPullRequestResolver(gitHubClient, objectMapper, 40);
	}

	@Test
	@DisplayName("Should keep merged pull requests of the same repository")
	void findsMergedPullRequests() {
		when(gitHubClient.getWithQuery("/repos/acme/app/issues/12/timeline", "per_page=100")).thenReturn("""
				[{"event": "labeled"},
				 {"event": "cross-referenced", "source": {"issue": {"number": 30, "pull_request": {},
				   "repository": {"full_name": "acme/app"}}}},
				 {"event": "cross-referenced", "source": {"issue": {"number": 31, "pull_request": {},
				   "repository": {"full_name": "acme/app"}}}},
				 {"event": "cross-referenced", "source": {"issue": {"number": 7, "pull_request": {},
				   "repository": {"full_name": "other/fork"}}}},
				 {"event": "cross-referenced", "source": {"issue": {"number": 13,
				   "repository": {"full_name": "acme/app"}}}}]
				""");
		when(gitHubClient.get("/repos/acme/app/pulls/30")).thenReturn("""
				{"number": 30, "title": "Add login", "body": "Closes #12", "html_url": "https://github.com/acme/app/pull/30",
				 "merged_at": "2024-01-11T08:00:00Z", "changed_files": 1, "additions": 3, "deletions": 1}
				""");
		when(gitHubClient.get("/repos/acme/app/pulls/31")).thenReturn("""
				{"number": 31, "title": "Abandoned", "merged_at": null}
				""");
		when(gitHubClient.getWithQuery("/repos/acme/app/pulls/30/files", "per_page=100")).thenReturn("""
				[{"filename": "Login.java", "status": "added", "additions": 3, "deletions": 1, "patch": "+ login()"}]
				""");

		List<LinkedPullRequest> linked = resolver.findLinkedPullRequests(TestIssues.repository(), 12);

		assertThat(linked).hasSize(1);
		LinkedPullRequest pr = linked.get(0);
		assertThat(pr.number()).isEqualTo(30);
		assertThat(pr.body()).isEqualTo("Closes #12");
		assertThat(pr.diff()).isEqualTo("--- Login.java\n+ login()\n");
		assertThat(pr.additions()).isEqualTo(3);
		verify(gitHubClient, never()).getWithQuery("/repos/acme/app/pulls/31/files", "per_page=100");
	}

	@Test
	@DisplayName("Should summarize files without patches")
	void summarizesWithoutPatches() throws Exception {
		JsonNode files = objectMapper.readTree("""
				[{"filename": "logo.png", "status": "added", "additions": 0, "deletions": 0}]
				""");

		assertThat(resolver.buildDiff(files)).isEqualTo("[added] logo.png (+0/-0)\n");
	}

	@Test
	@DisplayName("Should truncate long diffs")
	void truncatesLongDiffs() throws Exception {
		JsonNode files = objectMapper.readTree("""
				[{"filename": "A.java", "patch": "%s"}]
				""".formatted("x".repeat(100)));

		String diff = resolver.buildDiff(files);

		assertThat(diff).hasSize(40 + "\n... (diff truncated)".length());
		assertThat(diff).endsWith("... (diff truncated)");
	}

}
