package com.deepansh.coderflow.tool.impl;

import com.deepansh.coderflow.config.ToolProperties;
import com.deepansh.coderflow.tool.AgentTool;
import com.deepansh.coderflow.tool.ToolInvocation;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Base for the workspace file tools.
 *
 * Security model:
 * - All paths are sandboxed to tools.file-ops.base-directory
 * - Path traversal prevention: the normalized path must stay under the base directory
 * - Extension allowlist and size cap from {@link ToolProperties.FileOps}
 *
 * Invalid input or I/O failure completes the future exceptionally; the dispatcher
 * reports it to the calling agent as a tool failure. The base directory is created
 * on first use.
 */
@Slf4j
public abstract class WorkspaceFileTool implements AgentTool {

    protected final ToolProperties toolProperties;

    protected WorkspaceFileTool(ToolProperties toolProperties) {
        this.toolProperties = toolProperties;
    }

    @Override
    public final CompletableFuture<Object> execute(ToolInvocation invocation) {
        try {
            Files.createDirectories(baseDir());
            return CompletableFuture.completedFuture(run(invocation));
        } catch (IOException | RuntimeException e) {
            log.warn("{} failed [callId={}]: {}", getName(), invocation.callId(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    protected abstract String run(ToolInvocation invocation) throws IOException;

    /**
     * Resolves a relative path inside the base directory.
     *
     * @throws IllegalArgumentException if the path is blank
     * @throws SecurityException        if the path escapes the base directory
     */
    protected Path resolveSafePath(String relative) throws IOException {
        if (relative == null || relative.isBlank()) {
            throw new IllegalArgumentException("'path' is required");
        }
        Path base = baseDir().toRealPath(LinkOption.NOFOLLOW_LINKS);
        Path resolved = base.resolve(relative).normalize();

        if (!resolved.startsWith(base)) {
            throw new SecurityException("Path traversal attempt detected: '" + relative + "'");
        }
        return resolved;
    }

    protected Path baseDir() {
        return Paths.get(toolProperties.getFileOps().getBaseDirectory()).toAbsolutePath();
    }

    protected void checkExtension(Path path) {
        String ext = extensionOf(path.getFileName().toString());
        if (!toolProperties.getFileOps().getAllowedExtensionList().contains(ext)) {
            throw new IllegalArgumentException("Extension '." + ext + "' not allowed. " +
                    "Allowed: " + toolProperties.getFileOps().getAllowedExtensionList());
        }
    }

    protected int maxBytes() {
        return toolProperties.getFileOps().getMaxFileSizeKb() * 1024;
    }

    private static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot >= 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
