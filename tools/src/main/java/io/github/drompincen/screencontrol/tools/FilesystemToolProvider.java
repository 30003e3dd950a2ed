package io.github.drompincen.screencontrol.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.protocol.api.ToolInvocation;
import io.github.drompincen.screencontrol.runtime.provider.FilesystemProvider;
import io.github.drompincen.screencontrol.runtime.tools.ToolProvider;
import io.github.drompincen.screencontrol.runtime.tools.ToolResult;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.Map;

import static io.github.drompincen.screencontrol.tools.ToolArguments.bool;
import static io.github.drompincen.screencontrol.tools.ToolArguments.integer;
import static io.github.drompincen.screencontrol.tools.ToolArguments.text;

/** Dispatches the {@code fs_*} tools to a {@link FilesystemProvider}. */
public class FilesystemToolProvider implements ToolProvider {

    static final int DEFAULT_MAX_BYTES = 131072;
    static final int DEFAULT_MAX_RESULTS = 200;

    @FunctionalInterface
    private interface Handler {
        JsonNode handle(JsonNode args) throws IOException;
    }

    private final FilesystemProvider filesystem;
    private final Map<String, Handler> handlers;

    public FilesystemToolProvider(FilesystemProvider filesystem) {
        this.filesystem = filesystem;
        this.handlers = Map.of(
                "fs_list", args -> filesystem.list(text(args, "path"), bool(args, "recursive", false),
                        integer(args, "max_depth", bool(args, "recursive", false) ? 10 : 1)),
                "fs_read", args -> filesystem.read(text(args, "path"), integer(args, "max_bytes", DEFAULT_MAX_BYTES)),
                "fs_read_range", args -> filesystem.readRange(text(args, "path"),
                        integer(args, "start_line", 1), integer(args, "end_line", -1)),
                "fs_write", args -> filesystem.write(text(args, "path"), text(args, "content"),
                        "append".equalsIgnoreCase(text(args, "mode", "overwrite")),
                        bool(args, "create_directories", false)),
                "fs_delete", args -> filesystem.delete(text(args, "path"), bool(args, "recursive", false)),
                "fs_move", args -> filesystem.move(text(args, "source"), text(args, "destination")),
                "fs_search", args -> filesystem.search(text(args, "path"), text(args, "pattern"),
                        integer(args, "max_results", DEFAULT_MAX_RESULTS)),
                "fs_grep", args -> filesystem.grep(text(args, "path"), text(args, "pattern"), text(args, "glob"),
                        bool(args, "case_sensitive", true), integer(args, "max_matches", DEFAULT_MAX_RESULTS)),
                "fs_patch", args -> filesystem.patch(text(args, "path"), args.get("operations"),
                        bool(args, "dry_run", false)));
    }

    @Override
    public ToolCategory category() {
        return ToolCategory.FILESYSTEM;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        Handler handler = handlers.get(invocation.name());
        if (handler == null) {
            return ToolResult.failure("Unknown filesystem tool: " + invocation.name());
        }
        try {
            return ToolResult.success(handler.handle(invocation.arguments()));
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        } catch (NoSuchFileException e) {
            return ToolResult.failure("No such file or directory: " + e.getFile());
        } catch (AccessDeniedException e) {
            return ToolResult.failure("Permission denied: " + e.getFile());
        } catch (FileAlreadyExistsException e) {
            return ToolResult.failure("File " + e.getFile() + " already exists");
        } catch (DirectoryNotEmptyException e) {
            return ToolResult.failure("Directory " + e.getFile() + " is not empty");
        } catch (IOException e) {
            return ToolResult.failure("Filesystem operation failed: " + e.getMessage());
        }
    }
}
