package org.springaicommunity.github.auditor;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for GitHub API</li>
 * <li>{@link RestService} - typed GitHub lookups</li>
 * <li>{@link AuditWorkflow} - per-domain audit logic</li>
 * <li>{@link EventSink} - event transport</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Services, Workflows → Interfaces (NOT concrete implementations)
 *   Decorators → Interface they decorate
 *   Core → no Spring
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.auditor",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule services_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Services should depend on GitHubClient interface, not the concrete GitHubHttpClient");

	@ArchTest
	static final ArchRule workflows_should_depend_on_rest_service_interface = noClasses().that()
		.haveSimpleNameEndingWith("Workflow")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubRestService")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Workflows should only talk to GitHub through RestService");

	@ArchTest
	static final ArchRule engine_should_not_know_workflows = noClasses().that()
		.haveSimpleNameStartingWith("FanOut")
		.or()
		.haveSimpleName("PermitPool")
		.or()
		.haveSimpleName("CompletionStream")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Workflow")
		.because("The scheduler runs generic work units");

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

	// ========== Hierarchy Rules ==========

	@ArchTest
	static final ArchRule workflows_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("AuditWorkflow")
		.and()
		.doNotHaveSimpleName("AuditWorkflow")
		.should()
		.beAssignableTo(AuditWorkflow.class)
		.because("All *AuditWorkflow classes plug into the event emitter");

	// ========== Framework Independence ==========

	@ArchTest
	static final ArchRule core_should_not_depend_on_spring = noClasses().should()
		.dependOnClassesThat()
		.resideInAPackage("org.springframework..")
		.because("The core library is usable without Spring");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Audit")
		.or()
		.haveSimpleNameEndingWith("Record")
		.or()
		.haveSimpleNameEndingWith("Stats")
		.or()
		.haveSimpleNameEndingWith("Summary")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Model classes should be pure data without service dependencies");

}
