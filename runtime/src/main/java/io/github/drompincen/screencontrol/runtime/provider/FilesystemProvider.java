package io.github.drompincen.screencontrol.runtime.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Filesystem operations behind the {@code fs_*} tools. Every method returns the JSON
 * payload sent back to the client; bad arguments raise {@link IllegalArgumentException}.
 */
public interface FilesystemProvider {

    JsonNode list(String path, boolean recursive, int maxDepth) throws IOException;

    JsonNode read(String path, int maxBytes) throws IOException;

    /** Lines {@code startLine..endLine}, 1-based and inclusive; {@code endLine <= 0} means end of file. */
    JsonNode readRange(String path, int startLine, int endLine) throws IOException;

    JsonNode write(String path, String content, boolean append, boolean createDirectories) throws IOException;

    JsonNode delete(String path, boolean recursive) throws IOException;

    JsonNode move(String source, String destination) throws IOException;

    JsonNode search(String path, String glob, int maxResults) throws IOException;

    JsonNode grep(String path, String regex, String glob, boolean caseSensitive, int maxMatches) throws IOException;

    JsonNode patch(String path, JsonNode operations, boolean dryRun) throws IOException;
}
