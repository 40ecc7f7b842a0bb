package com.autonomous.crew.runtime.output;

import com.autonomous.crew.runtime.ExecutionProgress;
import com.autonomous.crew.runtime.TokenUsage;
import com.autonomous.crew.store.JsonFileSupport;
import com.autonomous.crew.support.TextUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

/**
 * Decodes newline-delimited JSON events emitted by agent CLIs in stream-json mode.
 */
public class StreamEventParser {

    static final int TOOL_ARGUMENT_SUMMARY_LENGTH = 60;
    static final int TOOL_INPUT_RENDER_LENGTH = 200;
    static final int TOOL_RESULT_RENDER_LENGTH = 500;

    private final ObjectMapper mapper = JsonFileSupport.newMapper();

    public Optional<JsonNode> decode(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(trimmed));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    public Optional<ExecutionProgress> toProgress(JsonNode raw) {
        JsonNode event = unwrap(raw);
        String type = event.path("type").asText("");

        if ("tool_use".equals(type) || event.has("tool_name")) {
            return Optional.of(toolUseProgress(toolName(event), event.path("input")));
        }
        switch (type) {
            case "content_block_start": {
                JsonNode block = event.path("content_block");
                String blockType = block.path("type").asText("");
                if ("tool_use".equals(blockType)) {
                    return Optional.of(ExecutionProgress.toolUse("Using " + block.path("name").asText("tool")));
                }
                if ("thinking".equals(blockType)) {
                    return Optional.of(ExecutionProgress.thinking("Thinking..."));
                }
                if ("text".equals(blockType)) {
                    return Optional.of(ExecutionProgress.text("Composing response..."));
                }
                return Optional.empty();
            }
            case "thinking":
                return Optional.of(ExecutionProgress.thinking("Thinking..."));
            case "message_start":
                return Optional.of(ExecutionProgress.thinking("Processing request..."));
            case "assistant":
                return assistantProgress(event.path("message").path("content"));
            default:
                return Optional.empty();
        }
    }

    /**
     * Markdown fragment for a terminal view, empty when the event has nothing to show.
     */
    public String render(JsonNode raw) {
        JsonNode event = unwrap(raw);
        String type = event.path("type").asText("");

        if ("tool_use".equals(type) || event.has("tool_name")) {
            return renderToolUse(toolName(event), event.path("input"));
        }
        switch (type) {
            case "tool_result":
                return renderToolResult(event.path("content"));
            case "content_block_delta": {
                JsonNode delta = event.path("delta");
                if (delta.hasNonNull("text")) {
                    return delta.get("text").asText();
                }
                return delta.path("thinking").asText("");
            }
            case "content_block_start":
                return "thinking".equals(event.path("content_block").path("type").asText())
                    ? "\n*thinking...*\n" : "";
            case "thinking":
                return "\n*thinking...*\n";
            case "assistant":
                return renderAssistant(event.path("message").path("content"));
            case "result":
                return event.hasNonNull("result") ? "\n" + event.get("result").asText() + "\n" : "";
            default:
                return "";
        }
    }

    /** Raw line for the terminal: rendered event, or the trimmed text of a non-JSON line. */
    public String renderLine(String line) {
        return decode(line).map(this::render).orElseGet(() -> line.trim().isEmpty() ? "" : line.trim() + "\n");
    }

    /**
     * Final answer of an execution. The last result event wins so resumed sessions report their latest turn.
     */
    public StreamResult parseResult(String output) {
        String[] lines = output.split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            Optional<JsonNode> event = decode(lines[i]);
            if (event.isPresent() && "result".equals(event.get().path("type").asText())) {
                JsonNode result = event.get();
                return new StreamResult(
                    result.path("result").asText(""),
                    result.hasNonNull("session_id") ? result.get("session_id").asText() : null,
                    true);
            }
        }

        Optional<JsonNode> whole = decode(output);
        if (whole.isPresent()) {
            JsonNode doc = whole.get();
            for (String field : new String[]{"result", "text", "content"}) {
                if (doc.hasNonNull(field)) {
                    String sessionId = doc.hasNonNull("session_id") ? doc.get("session_id").asText() : null;
                    return new StreamResult(doc.get(field).asText(), sessionId, false);
                }
            }
        }
        return new StreamResult(TextUtils.stripAnsi(output).trim(), null, false);
    }

    /**
     * Token usage, preferring an aggregate on a result event, else the sum of per-message usage blocks.
     * Returns null when the output carries no usage at all.
     */
    public TokenUsage extractUsage(String output) {
        String[] lines = output.split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            Optional<JsonNode> decoded = decode(lines[i]);
            if (decoded.isEmpty() || !"result".equals(decoded.get().path("type").asText())) {
                continue;
            }
            JsonNode result = decoded.get();
            if (result.has("total_input_tokens")) {
                return new TokenUsage(result.path("total_input_tokens").asLong(),
                    result.path("total_output_tokens").asLong());
            }
            if (result.has("usage")) {
                return usageOf(result.get("usage"));
            }
        }

        long in = 0;
        long out = 0;
        boolean found = false;
        for (String line : lines) {
            Optional<JsonNode> decoded = decode(line);
            if (decoded.isEmpty()) {
                continue;
            }
            JsonNode event = decoded.get();
            for (JsonNode usage : new JsonNode[]{event.path("usage"), event.path("message").path("usage")}) {
                if (usage.has("input_tokens") || usage.has("output_tokens")) {
                    in += usage.path("input_tokens").asLong();
                    out += usage.path("output_tokens").asLong();
                    found = true;
                    // one usage block per line
                    break;
                }
            }
        }
        return found ? new TokenUsage(in, out) : null;
    }

    private static JsonNode unwrap(JsonNode event) {
        if ("stream_event".equals(event.path("type").asText()) && event.has("event")) {
            return event.get("event");
        }
        return event;
    }

    private static String toolName(JsonNode event) {
        if (event.hasNonNull("tool_name")) {
            return event.get("tool_name").asText();
        }
        return event.path("name").asText("tool");
    }

    private static ExecutionProgress toolUseProgress(String tool, JsonNode input) {
        String argument = primaryArgument(input);
        if (argument == null || argument.isEmpty()) {
            return ExecutionProgress.toolUse("Using " + tool);
        }
        return ExecutionProgress.toolUse("Using " + tool + ": "
            + TextUtils.truncate(argument, TOOL_ARGUMENT_SUMMARY_LENGTH));
    }

    private static String primaryArgument(JsonNode input) {
        if (input.hasNonNull("command")) {
            return input.get("command").asText();
        }
        if (input.hasNonNull("file_path")) {
            return input.get("file_path").asText();
        }
        return null;
    }

    private Optional<ExecutionProgress> assistantProgress(JsonNode content) {
        ExecutionProgress text = null;
        for (JsonNode block : content) {
            String blockType = block.path("type").asText();
            if ("tool_use".equals(blockType)) {
                return Optional.of(toolUseProgress(block.path("name").asText("tool"), block.path("input")));
            }
            if ("text".equals(blockType) && text == null) {
                text = ExecutionProgress.text("Composing response...");
            }
        }
        return Optional.ofNullable(text);
    }

    private String renderAssistant(JsonNode content) {
        StringBuilder out = new StringBuilder();
        for (JsonNode block : content) {
            switch (block.path("type").asText()) {
                case "text" -> out.append(block.path("text").asText());
                case "tool_use" -> out.append(renderToolUse(block.path("name").asText("tool"), block.path("input")));
                case "thinking" -> out.append("\n*thinking...*\n");
                default -> {
                }
            }
        }
        return out.toString();
    }

    private String renderToolUse(String tool, JsonNode input) {
        String argument = primaryArgument(input);
        String shown = argument != null ? argument : (input.isMissingNode() ? "" : input.toString());
        return "\n`" + tool + "` " + TextUtils.truncate(shown, TOOL_INPUT_RENDER_LENGTH) + "\n";
    }

    private String renderToolResult(JsonNode content) {
        String text = content.isTextual() ? content.asText() : content.toString();
        return "\n```\n" + TextUtils.truncate(text, TOOL_RESULT_RENDER_LENGTH) + "\n```\n";
    }

    private static TokenUsage usageOf(JsonNode usage) {
        return new TokenUsage(usage.path("input_tokens").asLong(), usage.path("output_tokens").asLong());
    }
}
