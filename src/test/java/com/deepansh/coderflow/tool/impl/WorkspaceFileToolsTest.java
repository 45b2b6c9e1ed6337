package com.deepansh.coderflow.tool.impl;

import com.deepansh.coderflow.config.ToolProperties;
import com.deepansh.coderflow.tool.ToolInvocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkspaceFileToolsTest {

    @TempDir
    Path tempDir;

    private ReadFileTool readTool;
    private WriteFileTool writeTool;
    private ListDirectoryTool listTool;

    @BeforeEach
    void setUp() {
        ToolProperties props = new ToolProperties();
        props.getFileOps().setBaseDirectory(tempDir.toString());
        props.getFileOps().setMaxFileSizeKb(1);
        readTool = new ReadFileTool(props);
        writeTool = new WriteFileTool(props);
        listTool = new ListDirectoryTool(props);
    }

    private static ToolInvocation args(Map<String, Object> arguments) {
        return new ToolInvocation("call-1", arguments);
    }

    @Test
    void write_thenRead_roundTrips() {
        Object written = writeTool.execute(args(Map.of("path", "hello.py", "content", "print('hi')"))).join();
        Object read = readTool.execute(args(Map.of("path", "hello.py"))).join();

        assertThat(written).isEqualTo("Written successfully to 'hello.py' (11 bytes)");
        assertThat(read).isEqualTo("print('hi')");
    }

    @Test
    void write_createsParentDirectories() {
        writeTool.execute(args(Map.of("path", "src/pkg/app.py", "content", "x = 1"))).join();

        assertThat(tempDir.resolve("src/pkg/app.py")).hasContent("x = 1");
    }

    @Test
    void append_addsToExistingFile() {
        writeTool.execute(args(Map.of("path", "notes.txt", "content", "line1\n"))).join();
        Object result = writeTool.execute(args(Map.of("path", "notes.txt", "content", "line2\n", "append", true))).join();

        assertThat(result.toString()).startsWith("Appended");
        assertThat(readTool.execute(args(Map.of("path", "notes.txt"))).join()).isEqualTo("line1\nline2\n");
    }

    @Test
    void overwrite_replacesContent() {
        writeTool.execute(args(Map.of("path", "a.txt", "content", "a much longer first version"))).join();
        writeTool.execute(args(Map.of("path", "a.txt", "content", "short"))).join();

        assertThat(readTool.execute(args(Map.of("path", "a.txt"))).join()).isEqualTo("short");
    }

    @Test
    void write_disallowedExtension_fails() {
        assertThatThrownBy(() -> writeTool.execute(args(Map.of("path", "evil.exe", "content", "bad"))).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not allowed");
    }

    @Test
    void write_missingContent_fails() {
        assertThatThrownBy(() -> writeTool.execute(args(Map.of("path", "a.txt"))).join())
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'content' is required");
    }

    @Test
    void write_tooLarge_fails() {
        String big = "x".repeat(2048);

        assertThatThrownBy(() -> writeTool.execute(args(Map.of("path", "big.txt", "content", big))).join())
                .hasMessageContaining("Content too large");
        assertThat(tempDir.resolve("big.txt")).doesNotExist();
    }

    @Test
    void read_pathTraversal_fails() {
        assertThatThrownBy(() -> readTool.execute(args(Map.of("path", "../../etc/passwd"))).join())
                .hasCauseInstanceOf(SecurityException.class)
                .hasMessageContaining("Path traversal");
    }

    @Test
    void read_missingPath_fails() {
        assertThatThrownBy(() -> readTool.execute(args(Map.of())).join())
                .hasMessageContaining("'path' is required");
    }

    @Test
    void read_nonExistentFile_fails() {
        assertThatThrownBy(() -> readTool.execute(args(Map.of("path", "ghost.txt"))).join())
                .hasCauseInstanceOf(NoSuchFileException.class)
                .hasMessageContaining("File not found");
    }

    @Test
    void read_tooLarge_fails() throws Exception {
        Files.writeString(tempDir.resolve("large.txt"), "y".repeat(4096));

        assertThatThrownBy(() -> readTool.execute(args(Map.of("path", "large.txt"))).join())
                .hasMessageContaining("File too large");
    }

    @Test
    void list_showsFilesAndDirectoriesSorted() {
        writeTool.execute(args(Map.of("path", "b.txt", "content", "B"))).join();
        writeTool.execute(args(Map.of("path", "a.md", "content", "# A"))).join();
        writeTool.execute(args(Map.of("path", "src/main.py", "content", "pass"))).join();

        Object result = listTool.execute(args(Map.of())).join();

        assertThat(result).isEqualTo("Entries in '/':\na.md\nb.txt\nsrc/\nsrc/main.py");
    }

    @Test
    void list_subdirectory_isRelativeToWorkspaceRoot() {
        writeTool.execute(args(Map.of("path", "src/main.py", "content", "pass"))).join();

        Object result = listTool.execute(args(Map.of("path", "src"))).join();

        assertThat(result).isEqualTo("Entries in 'src':\nsrc/main.py");
    }

    @Test
    void list_emptyWorkspace_saysSo() {
        assertThat(listTool.execute(args(Map.of())).join()).isEqualTo("Directory '/' is empty.");
    }

    @Test
    void list_missingDirectory_fails() {
        assertThatThrownBy(() -> listTool.execute(args(Map.of("path", "nowhere"))).join())
                .hasCauseInstanceOf(NoSuchFileException.class);
    }
}
