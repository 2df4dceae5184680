package com.fixforge.core.triage;

import com.fixforge.core.config.FixforgeProperties;
import com.fixforge.core.model.Issue;
import com.fixforge.core.model.TriagedIssue;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ranks candidate issues by how easy they look to fix automatically.
 * <p>
 * Scoring is a pure function of the issue and the configured label and
 * keyword sets: 1 is the easiest, 5 the hardest.
 */
@Service
public class IssueTriageScorer {

    private static final Pattern FILE_MENTION =
            Pattern.compile("\\b\\w+\\.(py|js|ts|go|rs|java|cpp|c|h)\\b");

    private static final List<String> SPELLING_WORDS = List.of("typo", "spelling", "grammar");
    private static final List<String> DOC_WORDS = List.of("doc", "readme");

    private static final Comparator<TriagedIssue> EASIEST_FIRST = Comparator
            .comparingInt(TriagedIssue::difficulty)
            .thenComparingInt(TriagedIssue::comments);

    private final Set<String> friendlyLabels;
    private final Set<String> skipLabels;
    private final List<String> easyKeywords;

    @Autowired
    public IssueTriageScorer(FixforgeProperties properties) {
        this(properties.getTriage());
    }

    public IssueTriageScorer(FixforgeProperties.Triage triage) {
        this.friendlyLabels = lowerCase(triage.getFriendlyLabels());
        this.skipLabels = lowerCase(triage.getSkipLabels());
        this.easyKeywords = List.copyOf(lowerCase(triage.getEasyKeywords()));
    }

    /**
     * Scores one issue.
     */
    public TriagedIssue score(Issue issue) {
        String title = issue.title().toLowerCase(Locale.ROOT);
        String body = issue.body();
        String bodyLower = body.toLowerCase(Locale.ROOT);
        boolean friendly = hasFriendlyLabel(issue);

        double score = 3.0;
        if (friendly) {
            score -= 1;
        }
        if (easyKeywords.stream().anyMatch(k -> title.contains(k) || bodyLower.contains(k))) {
            score -= 1;
        }
        if (body.length() < 200) {
            score -= 0.5;
        }
        if (body.length() > 1000) {
            score += 1;
        }
        if (issue.comments() > 10) {
            score += 1;
        } else if (issue.comments() > 5) {
            score += 0.5;
        }
        int fileMentions = countFileMentions(body);
        if (fileMentions > 3) {
            score += 1;
        }

        // truncate toward zero first, then clamp
        int difficulty = Math.max(1, Math.min(5, (int) score));
        return new TriagedIssue(issue, difficulty,
                recommendation(issue, title, friendly, difficulty), Math.max(1, fileMentions));
    }

    /**
     * Drops issues that are already assigned or carry a skip label.
     */
    public List<Issue> filter(Collection<Issue> issues) {
        var result = new ArrayList<Issue>();
        for (Issue issue : issues) {
            if (!issue.assignees().isEmpty()) {
                continue;
            }
            if (issue.labels().stream().anyMatch(l -> skipLabels.contains(l.toLowerCase(Locale.ROOT)))) {
                continue;
            }
            result.add(issue);
        }
        return result;
    }

    /**
     * Filters, scores each survivor once and returns the {@code limit} easiest.
     */
    public List<TriagedIssue> best(Collection<Issue> issues, int limit) {
        List<TriagedIssue> scored = filter(issues).stream().map(this::score).toList();
        return rank(scored).stream().limit(Math.max(0, limit)).toList();
    }

    /**
     * Orders already scored issues by difficulty, then by comment count. Does not re-score.
     */
    public List<TriagedIssue> rank(Collection<TriagedIssue> triaged) {
        return triaged.stream().sorted(EASIEST_FIRST).toList();
    }

    private boolean hasFriendlyLabel(Issue issue) {
        return issue.labels().stream().anyMatch(l -> friendlyLabels.contains(l.toLowerCase(Locale.ROOT)));
    }

    private static int countFileMentions(String body) {
        Set<String> distinct = new LinkedHashSet<>();
        Matcher m = FILE_MENTION.matcher(body);
        while (m.find()) {
            distinct.add(m.group());
        }
        return distinct.size();
    }

    private static String recommendation(Issue issue, String title, boolean friendly, int difficulty) {
        var reasons = new ArrayList<String>();
        if (friendly) {
            reasons.add("friendly label");
        }
        if (SPELLING_WORDS.stream().anyMatch(title::contains)) {
            reasons.add("spelling/grammar fix");
        } else if (DOC_WORDS.stream().anyMatch(title::contains)) {
            reasons.add("documentation update");
        }
        if (issue.comments() == 0) {
            reasons.add("no comments");
        }

        String joined = String.join(", ", reasons);
        if (difficulty <= 2) {
            return reasons.isEmpty() ? "Recommended" : "Recommended: " + joined;
        }
        if (difficulty == 3) {
            return reasons.isEmpty() ? "Moderate difficulty" : "Worth a try: " + joined;
        }
        return "Hard, consider skipping";
    }

    private static Set<String> lowerCase(Collection<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
