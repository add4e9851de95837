package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One branch with the age of its head commit.
 *
 * @param repository repository name
 * @param branchName branch name
 * @param lastCommitDate head commit date as yyyy-MM-dd, null when unknown
 * @param ageDays days since the head commit, null when unknown
 * @param protectedBranch whether the branch is protected
 * @param degradedFields fields left unknown because the commit lookup failed
 */
public record BranchRecord(String repository, String branchName, @Nullable String lastCommitDate,
		@Nullable Long ageDays, @JsonProperty("protected") boolean protectedBranch, List<String> degradedFields) {
}
