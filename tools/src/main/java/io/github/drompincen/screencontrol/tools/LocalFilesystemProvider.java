package io.github.drompincen.screencontrol.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.screencontrol.runtime.provider.FilesystemProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/** {@link FilesystemProvider} backed by {@code java.nio.file} on the local disk. */
public class LocalFilesystemProvider implements FilesystemProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalFilesystemProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PathResolver resolver;

    public LocalFilesystemProvider(PathResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public JsonNode list(String path, boolean recursive, int maxDepth) throws IOException {
        Path dir = resolver.resolve(path);
        if (!Files.exists(dir)) {
            throw new IllegalArgumentException("Path does not exist: " + dir);
        }
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Path is not a directory: " + dir);
        }
        ArrayNode entries = MAPPER.createArrayNode();
        collectEntries(dir, entries, recursive, Math.max(1, maxDepth), 1);
        ObjectNode result = MAPPER.createObjectNode();
        result.put("path", dir.toString());
        result.set("entries", entries);
        return result;
    }

    private void collectEntries(Path dir, ArrayNode entries, boolean recursive, int maxDepth, int depth) throws IOException {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            stream.forEach(children::add);
        }
        children.sort(Comparator.comparing(Path::toString));
        for (Path child : children) {
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(child, BasicFileAttributes.class);
            } catch (IOException e) {
                log.debug("Skipping unreadable entry {}: {}", child, e.getMessage());
                continue;
            }
            ObjectNode entry = entries.addObject();
            entry.put("path", child.toString());
            entry.put("name", child.getFileName().toString());
            entry.put("type", attrs.isDirectory() ? "directory" : "file");
            entry.put("modified", attrs.lastModifiedTime().toInstant().toString());
            if (!attrs.isDirectory()) {
                entry.put("size", attrs.size());
            }
            if (recursive && attrs.isDirectory() && depth < maxDepth) {
                try {
                    collectEntries(child, entries, true, maxDepth, depth + 1);
                } catch (IOException e) {
                    log.debug("Cannot descend into {}: {}", child, e.getMessage());
                }
            }
        }
    }

    @Override
    public JsonNode read(String path, int maxBytes) throws IOException {
        Path file = existingFile(path);
        long size = Files.size(file);
        byte[] bytes;
        try (InputStream in = Files.newInputStream(file)) {
            bytes = in.readNBytes(maxBytes);
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.put("path", file.toString());
        result.put("content", new String(bytes, StandardCharsets.UTF_8));
        result.put("truncated", size > bytes.length);
        result.put("size", size);
        return result;
    }

    @Override
    public JsonNode readRange(String path, int startLine, int endLine) throws IOException {
        if (startLine < 1) {
            throw new IllegalArgumentException("start_line must be >= 1");
        }
        if (endLine > 0 && startLine > endLine) {
            throw new IllegalArgumentException("start_line (" + startLine + ") must be <= end_line (" + endLine + ")");
        }
        Path file = existingFile(path);
        List<String> lines = Arrays.asList(decode(Files.readAllBytes(file)).split("\n", -1));
        int total = lines.size();
        if (startLine > total) {
            throw new IllegalArgumentException("start_line (" + startLine + ") exceeds file length (" + total + " lines)");
        }
        int last = endLine <= 0 ? total : Math.min(endLine, total);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("path", file.toString());
        result.put("start_line", startLine);
        result.put("end_line", last);
        result.put("content", String.join("\n", lines.subList(startLine - 1, last)));
        result.put("total_lines", total);
        return result;
    }

    @Override
    public JsonNode write(String path, String content, boolean append, boolean createDirectories) throws IOException {
        Path file = resolver.resolve(path);
        Path parent = file.getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            if (!createDirectories) {
                throw new IllegalArgumentException("Parent directory does not exist: " + parent);
            }
            Files.createDirectories(parent);
        }
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        if (append) {
            Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } else {
            Files.write(file, bytes);
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.put("path", file.toString());
        result.put("bytes_written", bytes.length);
        return result;
    }

    @Override
    public JsonNode delete(String path, boolean recursive) throws IOException {
        Path target = resolver.resolve(path);
        if (!Files.exists(target)) {
            throw new IllegalArgumentException("Path does not exist: " + target);
        }
        if (Files.isDirectory(target)) {
            boolean empty;
            try (Stream<Path> children = Files.list(target)) {
                empty = children.findAny().isEmpty();
            }
            if (!empty && !recursive) {
                throw new IllegalArgumentException("Directory " + target + " is not empty. Use recursive: true to delete.");
            }
            deleteTree(target);
        } else {
            Files.delete(target);
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.put("path", target.toString());
        result.put("deleted", true);
        return result;
    }

    private static void deleteTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public JsonNode move(String source, String destination) throws IOException {
        Path from = resolver.resolve(source);
        Path to = resolver.resolve(destination);
        if (!Files.exists(from)) {
            throw new IllegalArgumentException("Source path does not exist: " + from);
        }
        if (to.getParent() != null) {
            Files.createDirectories(to.getParent());
        }
        Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        ObjectNode result = MAPPER.createObjectNode();
        result.put("from", from.toString());
        result.put("to", to.toString());
        result.put("moved", true);
        return result;
    }

    @Override
    public JsonNode search(String path, String glob, int maxResults) throws IOException {
        Path base = existingDirectory(path);
        PathMatcher matcher = globMatcher(glob);
        ArrayNode matches = MAPPER.createArrayNode();
        try (Stream<Path> walk = Files.walk(base)) {
            walk.filter(p -> !p.equals(base))
                    .filter(p -> matcher.matches(base.relativize(p)) || matcher.matches(p.getFileName()))
                    .limit(maxResults)
                    .forEach(p -> {
                        ObjectNode match = matches.addObject();
                        match.put("path", p.toString());
                        match.put("type", Files.isDirectory(p) ? "directory" : "file");
                    });
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.set("matches", matches);
        result.put("truncated", matches.size() >= maxResults);
        return result;
    }

    @Override
    public JsonNode grep(String path, String regex, String glob, boolean caseSensitive, int maxMatches) throws IOException {
        Path root = resolver.resolve(path);
        if (!Files.exists(root)) {
            throw new IllegalArgumentException("Path does not exist: " + root);
        }
        Pattern pattern = compile(regex, caseSensitive ? 0 : Pattern.CASE_INSENSITIVE);
        PathMatcher matcher = glob == null || glob.isBlank() ? null : globMatcher(glob);

        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(root)) {
            try (Stream<Path> walk = Files.walk(root)) {
                walk.filter(Files::isRegularFile)
                        .filter(p -> matcher == null || matcher.matches(p.getFileName()) || matcher.matches(root.relativize(p)))
                        .sorted()
                        .forEach(files::add);
            }
        } else {
            files.add(root);
        }

        ArrayNode matches = MAPPER.createArrayNode();
        outer:
        for (Path file : files) {
            String text;
            try {
                text = strictUtf8(Files.readAllBytes(file));
            } catch (CharacterCodingException e) {
                continue; // binary
            } catch (IOException e) {
                log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            String[] lines = text.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (pattern.matcher(lines[i]).find()) {
                    ObjectNode match = matches.addObject();
                    match.put("path", file.toString());
                    match.put("line", i + 1);
                    match.put("text", lines[i].strip());
                    if (matches.size() >= maxMatches) {
                        break outer;
                    }
                }
            }
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.set("matches", matches);
        result.put("truncated", matches.size() >= maxMatches);
        return result;
    }

    @Override
    public JsonNode patch(String path, JsonNode operations, boolean dryRun) throws IOException {
        if (operations == null || !operations.isArray()) {
            throw new IllegalArgumentException("operations must be an array");
        }
        Path file = existingFile(path);
        List<String> lines = new ArrayList<>(Arrays.asList(decode(Files.readAllBytes(file)).split("\n", -1)));
        int applied = 0;
        ArrayNode preview = MAPPER.createArrayNode();

        for (JsonNode op : operations) {
            String type = op.path("type").asText("");
            ObjectNode entry = preview.addObject();
            entry.put("operation", type);
            PatchChange change = switch (type) {
                case "replace_first", "replace_all" -> replace(lines, op, type.equals("replace_all"), entry);
                case "insert_before", "insert_after" -> insert(lines, op, type.equals("insert_after"), entry);
                default -> {
                    entry.put("error", "Unknown operation type: " + type);
                    yield null;
                }
            };
            entry.put("changed", change != null);
            if (change != null) {
                entry.put("before_excerpt", change.before());
                entry.put("after_excerpt", change.after());
                applied++;
            }
        }

        if (!dryRun && applied > 0) {
            Files.writeString(file, String.join("\n", lines), StandardCharsets.UTF_8);
            log.debug("Patched {} with {} operation(s)", file, applied);
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.put("path", file.toString());
        result.put("operations_applied", applied);
        if (dryRun) {
            result.set("preview", preview);
        }
        return result;
    }

    private record PatchChange(String before, String after) {
    }

    private static PatchChange replace(List<String> lines, JsonNode op, boolean all, ObjectNode entry) {
        if (!op.hasNonNull("pattern") || !op.hasNonNull("replacement")) {
            entry.put("error", "pattern and replacement required");
            return null;
        }
        Pattern pattern = compile(op.get("pattern").asText(), 0);
        String replacement = op.get("replacement").asText();
        PatchChange first = null;
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = pattern.matcher(lines.get(i));
            if (m.find()) {
                String before = lines.get(i);
                lines.set(i, m.replaceAll(replacement));
                if (first == null) {
                    first = new PatchChange(before, lines.get(i));
                }
                if (!all) {
                    break;
                }
            }
        }
        return first;
    }

    private static PatchChange insert(List<String> lines, JsonNode op, boolean after, ObjectNode entry) {
        if (!op.hasNonNull("match") || !op.hasNonNull("insert")) {
            entry.put("error", "match and insert required");
            return null;
        }
        Pattern pattern = compile(op.get("match").asText(), 0);
        String text = op.get("insert").asText();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (pattern.matcher(line).find()) {
                lines.add(after ? i + 1 : i, text);
                return new PatchChange(line, after ? line + "\n" + text : text + "\n" + line);
            }
        }
        return null;
    }

    private Path existingFile(String path) {
        Path file = resolver.resolve(path);
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("File does not exist: " + file);
        }
        if (Files.isDirectory(file)) {
            throw new IllegalArgumentException("Path is a directory, not a file: " + file);
        }
        return file;
    }

    private Path existingDirectory(String path) {
        Path dir = resolver.resolve(path);
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Path is not a directory: " + dir);
        }
        return dir;
    }

    private static PathMatcher globMatcher(String glob) {
        try {
            return FileSystems.getDefault().getPathMatcher("glob:" + glob);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid glob pattern: " + e.getDescription());
        }
    }

    private static Pattern compile(String regex, int flags) {
        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regular expression: " + e.getDescription());
        }
    }

    /** UTF-8 when valid, ISO-8859-1 otherwise. */
    private static String decode(byte[] bytes) {
        try {
            return strictUtf8(bytes);
        } catch (CharacterCodingException e) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    private static String strictUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
    }
}
