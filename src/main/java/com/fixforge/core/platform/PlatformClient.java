package com.fixforge.core.platform;

import com.fixforge.core.model.Issue;

import java.util.List;
import java.util.Optional;

/**
 * Hosting-platform operations the workflow depends on. Every method throws
 * {@link PlatformException} when the remote call fails.
 */
public interface PlatformClient {

    /**
     * Lists issues, excluding pull requests.
     *
     * @param labels only issues carrying at least one of these labels; empty for all
     * @param state  {@code open}, {@code closed} or {@code all}
     * @param limit  maximum number of issues returned
     */
    List<Issue> listIssues(String owner, String repo, List<String> labels, String state, int limit);

    Optional<Issue> findIssue(String owner, String repo, int number);

    /**
     * Open issues carrying any of the friendly labels, de-duplicated by number.
     */
    List<Issue> goodFirstIssues(String owner, String repo, int limit);

    PullRequestInfo createPullRequest(String owner, String repo, String title, String body,
                                      String head, String base);

    /** Login of the authenticated user. */
    String currentIdentity();

    /** Login of the user or organisation owning the repository. */
    String repositoryOwner(String owner, String repo);

    /** Forks the repository into the authenticated account and returns the fork's full name. */
    String fork(String owner, String repo);

    String cloneUrl(String owner, String repo, boolean ssh);
}
