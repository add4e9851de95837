package org.springaicommunity.github.auditor;

/**
 * Protection derived from the rulesets applying to a branch.
 *
 * @param allowsDirectPush false when a {@code pull_request} rule applies
 * @param hasRequiredReviewers true when that rule requires at least one approving review
 */
public record BranchRules(boolean allowsDirectPush, boolean hasRequiredReviewers) {

	public static final BranchRules NONE = new BranchRules(true, false);

}
