package com.fixforge.core.model;

import java.util.List;

/**
 * A reported defect as delivered by the hosting platform.
 *
 * @param number    issue number within its repository
 * @param title     issue title
 * @param body      issue description, never null
 * @param labels    label names
 * @param url       browser URL of the issue
 * @param comments  number of comments
 * @param assignees logins of assigned users
 * @param createdAt ISO-8601 creation timestamp, empty when unknown
 */
public record Issue(
    int number,
    String title,
    String body,
    List<String> labels,
    String url,
    int comments,
    List<String> assignees,
    String createdAt
) {
    public Issue {
        title = title != null ? title : "";
        body = body != null ? body : "";
        labels = labels != null ? List.copyOf(labels) : List.of();
        url = url != null ? url : "";
        assignees = assignees != null ? List.copyOf(assignees) : List.of();
        createdAt = createdAt != null ? createdAt : "";
    }

    public static Issue of(int number, String title, String body) {
        return new Issue(number, title, body, List.of(), "", 0, List.of(), "");
    }
}
