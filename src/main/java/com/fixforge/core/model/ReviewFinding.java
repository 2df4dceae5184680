package com.fixforge.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One finding reported by the automated review of a fix.
 *
 * @param title      short summary
 * @param body       explanation
 * @param priority   0 (blocking) to 3 (nit); 3 when the reviewer omitted it
 * @param confidence reviewer confidence between 0 and 1, null when absent
 * @param file       affected file, may be null
 * @param line       affected line, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewFinding(
    String title,
    String body,
    Integer priority,
    @JsonAlias("confidence_score") Double confidence,
    String file,
    Integer line
) {
    public ReviewFinding {
        title = title != null ? title : "";
        body = body != null ? body : "";
        priority = priority != null ? priority : 3;
    }

    public boolean isHighPriority() {
        return priority <= 1;
    }
}
