package com.deepansh.coderflow.core;

import com.deepansh.coderflow.model.Message;
import com.deepansh.coderflow.model.RawToolPayload;
import com.deepansh.coderflow.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Normalizes whatever shape a model used for tool invocations into canonical {@link ToolCall}s.
 *
 * Shapes are tried in {@link RawToolPayload#priority()} order; the first shape yielding
 * at least one call wins and the rest are ignored. An empty result is not an error,
 * it marks a plain-text turn.
 *
 * Never throws. Unparsable argument strings degrade to a single {@code query} argument,
 * unparsable {@code partial_json} fragments are logged and dropped, and descriptors
 * without a usable name are skipped.
 */
@Component
@Slf4j
public class CallExtractor {

    /** Correlation key some bindings inject into arguments; it lives on {@link ToolCall#getId()} instead */
    public static final String CALL_ID_KEY = "tool_call_id";

    /** Placeholder key emitted for positional single-argument tools */
    public static final String PLACEHOLDER_KEY = "__arg1";

    /** Argument name used when raw argument text cannot be parsed as a JSON object */
    public static final String FALLBACK_KEY = "query";

    private static final String TOOL_USE = "tool_use";
    private static final String TEXT = "text";

    private final ObjectMapper objectMapper;

    public CallExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ToolCall> extract(Message message) {
        if (message == null || message.getRawToolCalls() == null || message.getRawToolCalls().isEmpty()) {
            return List.of();
        }

        List<RawToolPayload> payloads = new ArrayList<>(message.getRawToolCalls());
        payloads.sort(Comparator.comparingInt(RawToolPayload::priority));

        for (RawToolPayload payload : payloads) {
            List<ToolCall> calls = extractFrom(payload);
            if (!calls.isEmpty()) {
                log.debug("Extracted {} tool call(s) from {} [author={}]",
                        calls.size(), payload.getClass().getSimpleName(), message.getAuthor());
                return calls;
            }
        }
        return List.of();
    }

    /**
     * Message text plus the text of any {@code "text"} content blocks, in order.
     * Routing directives are looked up in this.
     */
    public String textOf(Message message) {
        if (message == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (message.getText() != null) {
            sb.append(message.getText());
        }
        for (RawToolPayload payload : message.getRawToolCalls()) {
            if (payload instanceof RawToolPayload.ContentBlocks blocks) {
                for (Object block : blocks.blocks()) {
                    if (block instanceof Map<?, ?> map && TEXT.equals(map.get("type")) && map.get(TEXT) != null) {
                        if (sb.length() > 0) {
                            sb.append('\n');
                        }
                        sb.append(map.get(TEXT));
                    }
                }
            }
        }
        return sb.toString();
    }

    private List<ToolCall> extractFrom(RawToolPayload payload) {
        List<Descriptor> descriptors;
        if (payload instanceof RawToolPayload.DirectCalls direct) {
            descriptors = fromDirect(direct);
        } else if (payload instanceof RawToolPayload.MetadataCalls metadata) {
            descriptors = fromMetadata(metadata);
        } else if (payload instanceof RawToolPayload.ContentBlocks content) {
            descriptors = fromContentBlocks(content);
        } else {
            log.warn("Unknown tool-call payload shape: {}", payload);
            return List.of();
        }
        return canonicalize(descriptors);
    }

    // ─── Shape 1: direct descriptors ──────────────────────────────────────────

    private List<Descriptor> fromDirect(RawToolPayload.DirectCalls direct) {
        List<Descriptor> out = new ArrayList<>();
        for (Map<String, Object> raw : direct.calls()) {
            if (raw == null) {
                continue;
            }
            Map<String, Object> function = asMap(raw.get("function"));
            String name = firstNonBlank(asString(raw.get("name")), function != null ? asString(function.get("name")) : null);

            Object args = raw.containsKey("args") ? raw.get("args") : raw.get("arguments");
            if (args == null && function != null) {
                args = function.get("arguments");
            }
            out.add(new Descriptor(asString(raw.get("id")), name, coerceArguments(args, name)));
        }
        return out;
    }

    // ─── Shape 2: tool_calls inside extra metadata ────────────────────────────

    private List<Descriptor> fromMetadata(RawToolPayload.MetadataCalls metadata) {
        Object toolCalls = metadata.metadata().get("tool_calls");
        if (!(toolCalls instanceof List<?> list)) {
            return List.of();
        }
        List<Descriptor> out = new ArrayList<>();
        for (Object entry : list) {
            Map<String, Object> raw = asMap(entry);
            if (raw == null) {
                continue;
            }
            Map<String, Object> function = asMap(raw.get("function"));
            String name = firstNonBlank(function != null ? asString(function.get("name")) : null, asString(raw.get("name")));
            Object args = function != null ? function.get("arguments") : raw.get("arguments");
            out.add(new Descriptor(asString(raw.get("id")), name, coerceArguments(args, name)));
        }
        return out;
    }

    // ─── Shape 3: typed content blocks ────────────────────────────────────────

    private List<Descriptor> fromContentBlocks(RawToolPayload.ContentBlocks content) {
        List<Descriptor> out = new ArrayList<>();
        for (Object block : content.blocks()) {
            Map<String, Object> raw = asMap(block);
            if (raw == null || !TOOL_USE.equals(raw.get("type"))) {
                continue;
            }
            String name = asString(raw.get("name"));
            Map<String, Object> input = coerceArguments(raw.get("input"), name);
            mergePartialJson(input, raw.get("partial_json"), name);
            out.add(new Descriptor(asString(raw.get("id")), name, input));
        }
        return out;
    }

    private void mergePartialJson(Map<String, Object> input, Object fragment, String toolName) {
        if (fragment == null) {
            return;
        }
        if (fragment instanceof Map<?, ?> map) {
            map.forEach((k, v) -> input.put(String.valueOf(k), v));
            return;
        }
        String json = fragment.toString();
        if (json.isBlank()) {
            return;
        }
        try {
            Object parsed = objectMapper.readValue(json, Object.class);
            if (parsed instanceof Map<?, ?> map) {
                map.forEach((k, v) -> input.put(String.valueOf(k), v));
            } else {
                log.warn("Ignoring non-object partial_json for tool [{}]: {}", toolName, json);
            }
        } catch (JsonProcessingException e) {
            log.error("Dropping unparsable partial_json for tool [{}]: {}", toolName, json);
        }
    }

    // ─── Common normalization ─────────────────────────────────────────────────

    /**
     * Best-effort coercion of a raw argument value into an ordered map.
     * Maps are copied, blank strings mean no arguments, JSON object strings are parsed,
     * anything else becomes the single {@code query} argument.
     */
    private Map<String, Object> coerceArguments(Object raw, String toolName) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (raw == null) {
            return args;
        }
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> args.put(String.valueOf(k), v));
            return args;
        }
        String text = raw.toString();
        if (text.isBlank()) {
            return args;
        }
        try {
            Object parsed = objectMapper.readValue(text, Object.class);
            if (parsed instanceof Map<?, ?> map) {
                map.forEach((k, v) -> args.put(String.valueOf(k), v));
                return args;
            }
        } catch (JsonProcessingException e) {
            log.warn("Tool [{}] arguments are not valid JSON, passing raw text as '{}'", toolName, FALLBACK_KEY);
        }
        args.put(FALLBACK_KEY, text);
        return args;
    }

    private List<ToolCall> canonicalize(List<Descriptor> descriptors) {
        List<ToolCall> calls = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (Descriptor d : descriptors) {
            if (d.name() == null || d.name().isBlank()) {
                log.warn("Skipping tool call without a name: {}", d);
                continue;
            }
            Map<String, Object> args = new LinkedHashMap<>(d.arguments());
            args.remove(PLACEHOLDER_KEY);
            args.remove(CALL_ID_KEY);

            String id = d.id();
            if (id == null || id.isBlank() || !seenIds.add(id)) {
                id = synthesizeId();
                seenIds.add(id);
            }

            calls.add(ToolCall.builder()
                    .id(id)
                    .toolName(d.name().trim())
                    .arguments(args)
                    .build());
        }
        return calls;
    }

    private static String synthesizeId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static String firstNonBlank(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }

    private record Descriptor(String id, String name, Map<String, Object> arguments) {
    }
}
