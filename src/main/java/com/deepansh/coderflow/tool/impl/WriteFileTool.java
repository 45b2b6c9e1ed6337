package com.deepansh.coderflow.tool.impl;

import com.deepansh.coderflow.config.ToolProperties;
import com.deepansh.coderflow.tool.ToolInvocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

/**
 * Creates or overwrites a workspace file; {@code append=true} appends instead.
 */
@Component
@Slf4j
public class WriteFileTool extends WorkspaceFileTool {

    public WriteFileTool(ToolProperties toolProperties) {
        super(toolProperties);
    }

    @Override
    public String getName() {
        return "write_file";
    }

    @Override
    public String getDescription() {
        return "Create or overwrite a text file in the workspace. Parent directories are created as needed.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Path relative to the workspace root, e.g. 'hello_world.py'"
                        ),
                        "content", Map.of(
                                "type", "string",
                                "description", "Full file content"
                        ),
                        "append", Map.of(
                                "type", "boolean",
                                "description", "Append to the file instead of replacing it"
                        )
                ),
                "required", List.of("path", "content")
        );
    }

    @Override
    protected String run(ToolInvocation invocation) throws IOException {
        Path path = resolveSafePath(invocation.stringArgument("path"));
        String content = invocation.stringArgument("content");
        if (content == null) {
            throw new IllegalArgumentException("'content' is required");
        }
        checkExtension(path);

        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > maxBytes()) {
            throw new IllegalArgumentException(String.format(
                    "Content too large (%d bytes). Max: %d KB", bytes.length, maxBytes() / 1024));
        }

        boolean append = Boolean.parseBoolean(invocation.stringArgument("append"));
        Files.createDirectories(path.getParent());

        OpenOption[] options = append
                ? new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.APPEND}
                : new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING};
        Files.write(path, bytes, options);

        String action = append ? "Appended" : "Written";
        log.info("{} file: {} ({} bytes)", action, path.getFileName(), bytes.length);
        return String.format("%s successfully to '%s' (%d bytes)",
                action, invocation.stringArgument("path"), bytes.length);
    }
}
