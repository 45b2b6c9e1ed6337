package com.deepansh.coderflow.tool.impl;

import com.deepansh.coderflow.config.ToolProperties;
import com.deepansh.coderflow.tool.ToolInvocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class ReadFileTool extends WorkspaceFileTool {

    public ReadFileTool(ToolProperties toolProperties) {
        super(toolProperties);
    }

    @Override
    public String getName() {
        return "read_file";
    }

    @Override
    public String getDescription() {
        return "Read a text file from the workspace. Use it to inspect README files, sources and configs.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Path relative to the workspace root, e.g. 'README.md' or 'src/app.py'"
                        )
                ),
                "required", List.of("path")
        );
    }

    @Override
    protected String run(ToolInvocation invocation) throws IOException {
        Path path = resolveSafePath(invocation.stringArgument("path"));
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException("File not found: " + invocation.stringArgument("path"));
        }

        long size = Files.size(path);
        if (size > maxBytes()) {
            throw new IllegalArgumentException(String.format(
                    "File too large (%d KB). Max allowed: %d KB", size / 1024, maxBytes() / 1024));
        }

        String content = Files.readString(path, StandardCharsets.UTF_8);
        log.info("Read file: {} ({} bytes)", path.getFileName(), content.length());
        return content;
    }
}
