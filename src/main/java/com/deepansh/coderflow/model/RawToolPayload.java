package com.deepansh.coderflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool-call payload exactly as the model binding handed it over.
 *
 * Different providers put tool invocations in different places of a reply.
 * Each variant below is one of those places; {@code CallExtractor} resolves
 * them into canonical {@link ToolCall}s and nothing downstream sees them.
 *
 * Variants are listed in extraction priority order ({@link #priority()}).
 */
public sealed interface RawToolPayload
        permits RawToolPayload.DirectCalls, RawToolPayload.MetadataCalls, RawToolPayload.ContentBlocks {

    int priority();

    /**
     * Near-canonical descriptors attached straight to the message:
     * {@code {"id", "name", "args"}} or {@code {"id", "function": {"name", "arguments"}}}.
     */
    record DirectCalls(List<Map<String, Object>> calls) implements RawToolPayload {
        public DirectCalls {
            calls = calls == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(calls));
        }

        @Override
        public int priority() {
            return 1;
        }
    }

    /**
     * Extra metadata map carrying a {@code "tool_calls"} list in the OpenAI wire format,
     * where {@code function.arguments} is a JSON-encoded string.
     */
    record MetadataCalls(Map<String, Object> metadata) implements RawToolPayload {
        public MetadataCalls {
            metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }

        @Override
        public int priority() {
            return 2;
        }
    }

    /**
     * Typed content blocks. Blocks tagged {@code "tool_use"} carry {@code name},
     * {@code id}, {@code input} and possibly a {@code partial_json} fragment;
     * blocks tagged {@code "text"} carry prose.
     */
    record ContentBlocks(List<Object> blocks) implements RawToolPayload {
        public ContentBlocks {
            blocks = blocks == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(blocks));
        }

        @Override
        public int priority() {
            return 3;
        }
    }
}
