package org.springaicommunity.github.teamhealth;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for GitHub API</li>
 * <li>{@link SourceControlClient} - Typed GitHub queries used by sync</li>
 * <li>{@link LinkedPullRequestResolver} - Pull requests merged for an issue</li>
 * <li>{@link StructuredOutputService} - Schema-validated AI replies</li>
 * <li>{@code *Store} - Persistence operations, implemented outside this module</li>
 * <li>{@link MemberSource} - One step of the member fallback chain</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Services → Interfaces (NOT concrete implementations)
 *   Evaluators → AI and GitHub interfaces, never stores
 *   Core → no Spring
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.teamhealth",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule services_should_depend_on_client_interfaces = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubSourceControlClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubLinkedPullRequestResolver")
		.because("Services should depend on GitHubClient, SourceControlClient and LinkedPullRequestResolver");

	@ArchTest
	static final ArchRule evaluators_should_not_touch_stores = noClasses().that()
		.haveSimpleNameEndingWith("Evaluator")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Store")
		.because("Evaluators compute results; EvaluationService persists them");

	@ArchTest
	static final ArchRule core_should_not_depend_on_spring = noClasses().should()
		.dependOnClassesThat()
		.resideInAPackage("org.springframework..")
		.because("Spring wiring lives in the application module");

	// ========== Decorator Rules ==========

	@ArchTest
	static final ArchRule github_client_decorators_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("GitHubClient")
		.and()
		.doNotHaveSimpleName("GitHubClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *GitHubClient classes should implement the GitHubClient interface");

	@ArchTest
	static final ArchRule decorators_should_not_depend_on_concrete_http_client = noClasses().that()
		.haveSimpleName("RetryingGitHubClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Decorators should depend on the GitHubClient interface, not concrete implementation");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule member_sources_should_implement_interface = classes().that()
		.areAssignableTo(SourceControlMemberSource.class)
		.should()
		.implement(MemberSource.class)
		.because("Every member source takes part in the fallback chain");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Evaluation")
		.or()
		.haveSimpleNameEndingWith("Score")
		.or()
		.haveSimpleNameEndingWith("Summary")
		.or()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("Stats")
		.or()
		.haveSimpleName("Issue")
		.or()
		.haveSimpleName("PullRequest")
		.or()
		.haveSimpleName("Collaborator")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Model classes should be pure data without service dependencies");

	@ArchTest
	static final ArchRule support_classes_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Parser")
		.or()
		.haveSimpleNameEndingWith("Schema")
		.or()
		.haveSimpleNameEndingWith("Resolver")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Support classes should not depend on higher-level services");

}
