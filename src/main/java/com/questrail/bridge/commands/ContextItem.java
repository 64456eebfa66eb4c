package com.questrail.bridge.commands;

import java.util.Objects;

/**
 * A file or directory the user attached as context for a message.
 *
 * @param id   random identifier, unique per attachment
 * @param path the path as given by the user
 * @param type {@value #FILE} or {@value #DIRECTORY}
 * @param size size in bytes as reported by the file system
 */
public record ContextItem(
        String id,
        String path,
        String type,
        long size
) {
    public static final String FILE = "file";
    public static final String DIRECTORY = "directory";

    public ContextItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(type, "type");
        if (!FILE.equals(type) && !DIRECTORY.equals(type)) {
            throw new IllegalArgumentException("type must be file or directory: " + type);
        }
    }

    public boolean isDirectory() {
        return DIRECTORY.equals(type);
    }
}
