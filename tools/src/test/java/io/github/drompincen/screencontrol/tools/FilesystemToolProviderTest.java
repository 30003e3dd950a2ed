package io.github.drompincen.screencontrol.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.screencontrol.protocol.api.ToolInvocation;
import io.github.drompincen.screencontrol.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FilesystemToolProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private FilesystemToolProvider provider;

    @BeforeEach
    void setUp() {
        provider = new FilesystemToolProvider(new LocalFilesystemProvider(new PathResolver(tempDir)));
    }

    @Test
    void readsFileSuccessfully() throws IOException {
        Files.writeString(tempDir.resolve("test.txt"), "Hello World");

        ToolResult result = call("fs_read", args().put("path", "test.txt"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("content").asText()).isEqualTo("Hello World");
        assertThat(result.output().get("truncated").asBoolean()).isFalse();
        assertThat(result.output().get("size").asLong()).isEqualTo(11);
    }

    @Test
    void readHonoursMaxBytes() throws IOException {
        Files.writeString(tempDir.resolve("big.txt"), "0123456789");

        ToolResult result = call("fs_read", args().put("path", "big.txt").put("max_bytes", 4));

        assertThat(result.output().get("content").asText()).isEqualTo("0123");
        assertThat(result.output().get("truncated").asBoolean()).isTrue();
    }

    @Test
    void failsForMissingFile() {
        ToolResult result = call("fs_read", args().put("path", "nonexistent.txt"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("File does not exist");
    }

    @Test
    void readRangeIsOneBasedAndInclusive() throws IOException {
        Files.writeString(tempDir.resolve("lines.txt"), "a\nb\nc\nd");

        ToolResult result = call("fs_read_range", args().put("path", "lines.txt").put("start_line", 2).put("end_line", 3));

        assertThat(result.output().get("content").asText()).isEqualTo("b\nc");
        assertThat(result.output().get("total_lines").asInt()).isEqualTo(4);
    }

    @Test
    void readRangeRejectsStartBeyondEnd() throws IOException {
        Files.writeString(tempDir.resolve("lines.txt"), "a\nb");

        ToolResult result = call("fs_read_range", args().put("path", "lines.txt").put("start_line", 5));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("exceeds file length");
    }

    @Test
    void writeCreatesDirectoriesAndAppends() throws IOException {
        call("fs_write", args().put("path", "nested/dir/out.txt").put("content", "one").put("create_directories", true));
        ToolResult result = call("fs_write", args().put("path", "nested/dir/out.txt").put("content", "two").put("mode", "append"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("bytes_written").asInt()).isEqualTo(3);
        assertThat(Files.readString(tempDir.resolve("nested/dir/out.txt"))).isEqualTo("onetwo");
    }

    @Test
    void writeWithoutParentFails() {
        ToolResult result = call("fs_write", args().put("path", "missing/out.txt").put("content", "x"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("Parent directory does not exist");
    }

    @Test
    void deleteRequiresRecursiveForNonEmptyDirectory() throws IOException {
        Files.createDirectories(tempDir.resolve("d/e"));
        Files.writeString(tempDir.resolve("d/e/f.txt"), "x");

        ToolResult refused = call("fs_delete", args().put("path", "d"));
        ToolResult deleted = call("fs_delete", args().put("path", "d").put("recursive", true));

        assertThat(refused.success()).isFalse();
        assertThat(refused.error()).contains("not empty");
        assertThat(deleted.success()).isTrue();
        assertThat(Files.exists(tempDir.resolve("d"))).isFalse();
    }

    @Test
    void moveRenamesFile() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "x");

        ToolResult result = call("fs_move", args().put("source", "a.txt").put("destination", "sub/b.txt"));

        assertThat(result.output().get("moved").asBoolean()).isTrue();
        assertThat(Files.exists(tempDir.resolve("sub/b.txt"))).isTrue();
        assertThat(Files.exists(tempDir.resolve("a.txt"))).isFalse();
    }

    @Test
    void listReturnsEntriesRecursively() throws IOException {
        Files.createDirectories(tempDir.resolve("src/main"));
        Files.writeString(tempDir.resolve("src/main/App.java"), "class App {}");
        Files.writeString(tempDir.resolve("README.md"), "# readme");

        ToolResult flat = call("fs_list", args().put("path", "."));
        ToolResult deep = call("fs_list", args().put("path", ".").put("recursive", true));

        assertThat(flat.output().get("entries")).hasSize(2);
        assertThat(deep.output().get("entries").toString()).contains("App.java");
    }

    @Test
    void searchMatchesGlob() throws IOException {
        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("src/A.java"), "");
        Files.writeString(tempDir.resolve("src/B.txt"), "");

        ToolResult result = call("fs_search", args().put("path", ".").put("pattern", "*.java"));

        assertThat(result.output().get("matches")).hasSize(1);
        assertThat(result.output().get("matches").get(0).get("path").asText()).endsWith("A.java");
    }

    @Test
    void grepReportsLineNumbers() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "alpha\nbeta\nALPHA again");

        ToolResult sensitive = call("fs_grep", args().put("path", ".").put("pattern", "alpha"));
        ToolResult insensitive = call("fs_grep", args().put("path", ".").put("pattern", "alpha").put("case_sensitive", false));

        assertThat(sensitive.output().get("matches")).hasSize(1);
        assertThat(sensitive.output().get("matches").get(0).get("line").asInt()).isEqualTo(1);
        assertThat(insensitive.output().get("matches")).hasSize(2);
    }

    @Test
    void grepRejectsBadRegex() {
        ToolResult result = call("fs_grep", args().put("path", ".").put("pattern", "("));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Invalid regular expression");
    }

    @Test
    void patchDryRunLeavesFileUntouched() throws IOException {
        Path file = tempDir.resolve("conf.txt");
        Files.writeString(file, "port=1\nhost=a");
        ObjectNode input = args().put("path", "conf.txt").put("dry_run", true);
        ArrayNode ops = input.putArray("operations");
        ops.addObject().put("type", "replace_first").put("pattern", "port=\\d+").put("replacement", "port=2");

        ToolResult result = call("fs_patch", input);

        assertThat(result.output().get("operations_applied").asInt()).isEqualTo(1);
        assertThat(result.output().get("preview").get(0).get("after_excerpt").asText()).isEqualTo("port=2");
        assertThat(Files.readString(file)).isEqualTo("port=1\nhost=a");
    }

    @Test
    void patchAppliesInsertsAndReplaceAll() throws IOException {
        Path file = tempDir.resolve("list.txt");
        Files.writeString(file, "x1\nmid\nx2");
        ObjectNode input = args().put("path", "list.txt");
        ArrayNode ops = input.putArray("operations");
        ops.addObject().put("type", "replace_all").put("pattern", "x").put("replacement", "y");
        ops.addObject().put("type", "insert_before").put("match", "^mid$").put("insert", "before");
        ops.addObject().put("type", "insert_after").put("match", "^mid$").put("insert", "after");
        ops.addObject().put("type", "insert_after").put("match", "nomatch").put("insert", "never");

        ToolResult result = call("fs_patch", input);

        assertThat(result.output().get("operations_applied").asInt()).isEqualTo(3);
        assertThat(result.output().has("preview")).isFalse();
        assertThat(Files.readString(file)).isEqualTo("y1\nbefore\nmid\nafter\ny2");
    }

    private ToolResult call(String tool, ObjectNode input) {
        return provider.execute(new ToolInvocation(tool, input));
    }

    private ObjectNode args() {
        return mapper.createObjectNode();
    }
}
