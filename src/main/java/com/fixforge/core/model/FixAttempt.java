package com.fixforge.core.model;

import java.util.Optional;

/**
 * One run of the fix pipeline against a single issue. Created fresh for every
 * invocation, mutated only by the thread running it and handed back to the
 * caller as the terminal result.
 */
public class FixAttempt {

    private final String workflowId;
    private final int issueNumber;
    private final String issueTitle;

    private FixState state = FixState.PENDING;
    private String branchName = "";
    private String diff = "";
    private ReviewReport review;
    private String pullRequestUrl = "";
    private boolean success;
    private String error = "";
    private final StringBuilder log = new StringBuilder();

    public FixAttempt(String workflowId, int issueNumber, String issueTitle) {
        this.workflowId = workflowId;
        this.issueNumber = issueNumber;
        this.issueTitle = issueTitle != null ? issueTitle : "";
    }

    /**
     * Moves to {@code next}. Re-entering the current state is a no-op so a
     * step may announce progress more than once.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void advance(FixState next) {
        if (next == state) {
            return;
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Fix attempt %s cannot move from %s to %s".formatted(workflowId, state, next));
        }
        state = next;
    }

    public void fail(String error) {
        this.error = error != null ? error : "";
        this.success = false;
        if (!state.isTerminal()) {
            state = FixState.ERROR;
        }
    }

    public void succeed() {
        this.success = true;
    }

    public void appendLog(String line) {
        log.append(line).append('\n');
    }

    public String getWorkflowId() { return workflowId; }
    public int getIssueNumber() { return issueNumber; }
    public String getIssueTitle() { return issueTitle; }
    public FixState getState() { return state; }
    public String getBranchName() { return branchName; }
    public String getDiff() { return diff; }
    public Optional<ReviewReport> getReview() { return Optional.ofNullable(review); }
    public String getPullRequestUrl() { return pullRequestUrl; }
    public boolean isSuccess() { return success; }
    public String getError() { return error; }
    public String getLog() { return log.toString(); }

    public void setBranchName(String branchName) { this.branchName = branchName; }
    public void setDiff(String diff) { this.diff = diff; }
    public void setReview(ReviewReport review) { this.review = review; }
    public void setPullRequestUrl(String pullRequestUrl) { this.pullRequestUrl = pullRequestUrl; }
}
