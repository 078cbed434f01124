package com.rulewise.core.fetch;

import com.rulewise.core.config.ConfigurationException;

import java.util.regex.Pattern;

/**
 * Repository coordinates of a content source, written {@code owner/repo}.
 */
public record ContentSourceId(String owner, String repo) {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_.-]+");

    public ContentSourceId {
        if (owner == null || !SEGMENT.matcher(owner).matches()) {
            throw new ConfigurationException("Invalid content source owner: " + owner, "rulewise.source.id");
        }
        if (repo == null || !SEGMENT.matcher(repo).matches()) {
            throw new ConfigurationException("Invalid content source repository: " + repo, "rulewise.source.id");
        }
    }

    /**
     * Parses {@code owner/repo}.
     *
     * @throws ConfigurationException if the value is not exactly two non-empty segments
     */
    public static ContentSourceId parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Content source id is not set", "rulewise.source.id");
        }
        String[] parts = value.trim().split("/", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new ConfigurationException(
                    "Content source id must be 'owner/repo', got '%s'".formatted(value), "rulewise.source.id");
        }
        return new ContentSourceId(parts[0], parts[1]);
    }

    @Override
    public String toString() {
        return owner + "/" + repo;
    }
}
