package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Security overview of one repository.
 *
 * @param repository repository name
 * @param owner owning organization
 * @param description repository description
 * @param topics topics joined with ", "
 * @param privateRepository whether the repository is private
 * @param archived whether the repository is archived
 * @param defaultBranch default branch name
 * @param language primary language
 * @param stars stargazer count
 * @param forks fork count
 * @param adminCount number of collaborators with admin permission
 * @param adminNames their logins joined with ", "
 * @param hasCodeowners whether a CODEOWNERS file exists in a recognized location
 * @param hasRequiredReviewers whether the default branch requires approving reviews
 * @param allowsDirectPush whether the default branch accepts pushes without a pull
 * request
 * @param url repository web URL
 * @param branchCount number of branches
 * @param degradedFields fields holding placeholder values because a lookup failed
 */
public record RepositoryAudit(String repository, String owner, @Nullable String description, String topics,
		@JsonProperty("private") boolean privateRepository, boolean archived, String defaultBranch,
		@Nullable String language, int stars, int forks, int adminCount, String adminNames, boolean hasCodeowners,
		boolean hasRequiredReviewers, boolean allowsDirectPush, String url, int branchCount,
		List<String> degradedFields) {
}
