package com.fixforge.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured result of the automated review of a fix diff.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewReport(
    List<ReviewFinding> findings,
    @JsonProperty("overall_correctness") String overallCorrectness,
    @JsonProperty("overall_confidence") @JsonAlias("overall_confidence_score") Double overallConfidence
) {
    public ReviewReport {
        findings = findings != null ? List.copyOf(findings) : List.of();
        overallCorrectness = overallCorrectness != null ? overallCorrectness : "";
    }

    public List<ReviewFinding> highPriorityFindings() {
        return findings.stream().filter(ReviewFinding::isHighPriority).toList();
    }
}
