package com.fixforge.core.platform;

import com.fixforge.core.model.Issue;
import org.kohsuke.github.GHException;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHIssue;
import org.kohsuke.github.GHIssueState;
import org.kohsuke.github.GHLabel;
import org.kohsuke.github.GHPullRequest;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GHUser;
import org.kohsuke.github.GitHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link PlatformClient} on top of the GitHub REST API.
 */
public class GitHubPlatformClient implements PlatformClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubPlatformClient.class);
    private static final int PAGE_SIZE = 100;

    private final GitHub github;
    private final List<String> friendlyLabels;

    public GitHubPlatformClient(GitHub github, List<String> friendlyLabels) {
        this.github = github;
        this.friendlyLabels = List.copyOf(friendlyLabels);
    }

    @Override
    public List<Issue> listIssues(String owner, String repo, List<String> labels, String state, int limit) {
        Set<String> wanted = lowerCase(labels);
        var result = new ArrayList<Issue>();
        if (limit <= 0) {
            return result;
        }
        try {
            for (GHIssue ghIssue : repository(owner, repo).listIssues(issueState(state)).withPageSize(PAGE_SIZE)) {
                if (ghIssue.isPullRequest()) {
                    continue;
                }
                Issue issue = toIssue(ghIssue);
                if (!wanted.isEmpty() && issue.labels().stream()
                        .noneMatch(l -> wanted.contains(l.toLowerCase(Locale.ROOT)))) {
                    continue;
                }
                result.add(issue);
                if (result.size() >= limit) {
                    break;
                }
            }
        } catch (IOException | GHException e) {
            throw new PlatformException("Failed to list issues of %s/%s: %s".formatted(owner, repo, e.getMessage()), e);
        }
        log.debug("Listed {} issue(s) of {}/{}", result.size(), owner, repo);
        return result;
    }

    @Override
    public Optional<Issue> findIssue(String owner, String repo, int number) {
        try {
            GHIssue ghIssue = repository(owner, repo).getIssue(number);
            if (ghIssue.isPullRequest()) {
                return Optional.empty();
            }
            return Optional.of(toIssue(ghIssue));
        } catch (GHFileNotFoundException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new PlatformException("Failed to load issue #%d of %s/%s: %s".formatted(
                    number, owner, repo, e.getMessage()), e);
        }
    }

    @Override
    public List<Issue> goodFirstIssues(String owner, String repo, int limit) {
        Map<Integer, Issue> byNumber = new LinkedHashMap<>();
        for (Issue issue : listIssues(owner, repo, friendlyLabels, "open", limit)) {
            byNumber.putIfAbsent(issue.number(), issue);
        }
        return byNumber.values().stream().limit(limit).toList();
    }

    @Override
    public PullRequestInfo createPullRequest(String owner, String repo, String title, String body,
                                             String head, String base) {
        try {
            GHPullRequest pr = repository(owner, repo).createPullRequest(title, head, base, body);
            String url = pr.getHtmlUrl() != null ? pr.getHtmlUrl().toString() : "";
            log.info("Created pull request #{} on {}/{}: {}", pr.getNumber(), owner, repo, url);
            return new PullRequestInfo(pr.getNumber(), url, pr.getTitle());
        } catch (IOException e) {
            throw new PlatformException("Failed to create pull request on %s/%s: %s".formatted(
                    owner, repo, e.getMessage()), e);
        }
    }

    @Override
    public String currentIdentity() {
        try {
            return github.getMyself().getLogin();
        } catch (IOException e) {
            throw new PlatformException("Failed to resolve authenticated user: " + e.getMessage(), e);
        }
    }

    @Override
    public String repositoryOwner(String owner, String repo) {
        return repository(owner, repo).getOwnerName();
    }

    @Override
    public String fork(String owner, String repo) {
        try {
            GHRepository fork = repository(owner, repo).fork();
            log.info("Forked {}/{} to {}", owner, repo, fork.getFullName());
            return fork.getFullName();
        } catch (IOException e) {
            throw new PlatformException("Failed to fork %s/%s: %s".formatted(owner, repo, e.getMessage()), e);
        }
    }

    @Override
    public String cloneUrl(String owner, String repo, boolean ssh) {
        GHRepository repository = repository(owner, repo);
        return ssh ? repository.getSshUrl() : repository.getHttpTransportUrl();
    }

    private GHRepository repository(String owner, String repo) {
        try {
            return github.getRepository(owner + "/" + repo);
        } catch (IOException e) {
            throw new PlatformException("Failed to load repository %s/%s: %s".formatted(owner, repo, e.getMessage()), e);
        }
    }

    private static Issue toIssue(GHIssue ghIssue) throws IOException {
        List<String> labels = ghIssue.getLabels().stream().map(GHLabel::getName).toList();
        List<String> assignees = ghIssue.getAssignees().stream().map(GHUser::getLogin).toList();
        Date created = ghIssue.getCreatedAt();
        return new Issue(
                ghIssue.getNumber(),
                ghIssue.getTitle(),
                ghIssue.getBody(),
                labels,
                ghIssue.getHtmlUrl() != null ? ghIssue.getHtmlUrl().toString() : "",
                ghIssue.getCommentsCount(),
                assignees,
                created != null ? created.toInstant().toString() : "");
    }

    private static GHIssueState issueState(String state) {
        if (state == null) {
            return GHIssueState.OPEN;
        }
        return switch (state.toLowerCase(Locale.ROOT)) {
            case "closed" -> GHIssueState.CLOSED;
            case "all" -> GHIssueState.ALL;
            default -> GHIssueState.OPEN;
        };
    }

    private static Set<String> lowerCase(List<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }
}
