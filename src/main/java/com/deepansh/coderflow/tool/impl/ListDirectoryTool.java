package com.deepansh.coderflow.tool.impl;

import com.deepansh.coderflow.config.ToolProperties;
import com.deepansh.coderflow.tool.ToolInvocation;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists a workspace directory two levels deep. Directories end with '/'.
 */
@Component
public class ListDirectoryTool extends WorkspaceFileTool {

    private static final int MAX_DEPTH = 2;

    public ListDirectoryTool(ToolProperties toolProperties) {
        super(toolProperties);
    }

    @Override
    public String getName() {
        return "list_directory";
    }

    @Override
    public String getDescription() {
        return "List files and directories in the workspace. Use it first to explore the project structure.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Directory relative to the workspace root. Defaults to the root."
                        )
                )
        );
    }

    @Override
    protected String run(ToolInvocation invocation) throws IOException {
        String requested = invocation.stringArgument("path");
        boolean root = requested == null || requested.isBlank() || ".".equals(requested.trim());
        Path dir = root ? baseDir().toRealPath() : resolveSafePath(requested);

        if (!Files.isDirectory(dir)) {
            throw new NoSuchFileException("Directory not found: " + requested);
        }

        Path base = baseDir().toRealPath();
        String entries;
        try (Stream<Path> stream = Files.walk(dir, MAX_DEPTH)) {
            entries = stream
                    .filter(p -> !p.equals(dir))
                    .sorted()
                    .map(p -> base.relativize(p) + (Files.isDirectory(p) ? "/" : ""))
                    .collect(Collectors.joining("\n"));
        }

        String label = root ? "/" : requested;
        return entries.isEmpty()
                ? "Directory '" + label + "' is empty."
                : "Entries in '" + label + "':\n" + entries;
    }
}
