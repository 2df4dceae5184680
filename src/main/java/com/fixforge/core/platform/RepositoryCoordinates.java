package com.fixforge.core.platform;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owner and name of a hosted repository, parsed from its clone URL.
 */
public record RepositoryCoordinates(String owner, String name) {

    /** Matches {@code https://host/owner/name(.git)} and {@code git@host:owner/name(.git)}. */
    private static final Pattern REMOTE = Pattern.compile(
            "^(?:[a-z+]+://(?:[^@/]+@)?[^/]+/|[^@\\s]+@[^:]+:)([^/]+)/([^/]+?)(?:\\.git)?/?$");

    public static Optional<RepositoryCoordinates> parse(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher m = REMOTE.matcher(url.strip());
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new RepositoryCoordinates(m.group(1), m.group(2)));
    }

    public String fullName() {
        return owner + "/" + name;
    }
}
